package com.jreinhal.edbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.evidence")
public class EvidenceProperties {
    private boolean enabled = true;
    private int maxNgram = 15;
    private int minNgram = 4;
    /**
     * N-grams shorter than this many normalized characters are not searched.
     */
    private int minMatchChars = 15;
    /**
     * Spans closer than this many characters are merged.
     */
    private int mergeGap = 20;
    /**
     * Half-width of the window re-scanned around an estimated original offset.
     */
    private int rescanWindow = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxNgram() {
        return maxNgram;
    }

    public void setMaxNgram(int maxNgram) {
        this.maxNgram = maxNgram;
    }

    public int getMinNgram() {
        return minNgram;
    }

    public void setMinNgram(int minNgram) {
        this.minNgram = minNgram;
    }

    public int getMinMatchChars() {
        return minMatchChars;
    }

    public void setMinMatchChars(int minMatchChars) {
        this.minMatchChars = minMatchChars;
    }

    public int getMergeGap() {
        return mergeGap;
    }

    public void setMergeGap(int mergeGap) {
        this.mergeGap = mergeGap;
    }

    public int getRescanWindow() {
        return rescanWindow;
    }

    public void setRescanWindow(int rescanWindow) {
        this.rescanWindow = rescanWindow;
    }
}
