package com.jreinhal.edbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.validation")
public class ValidationProperties {
    /**
     * Fraction of a statement's significant terms that must appear in the source text.
     */
    private double supportThreshold = 0.6;

    /**
     * Above this fraction of unsupported statements the answer is rejected.
     */
    private double maxUnsupportedRatio = 0.4;

    /**
     * Criteria answers shorter than this many characters are rejected as incomplete.
     */
    private int minCriteriaLength = 80;

    public double getSupportThreshold() {
        return supportThreshold;
    }

    public void setSupportThreshold(double supportThreshold) {
        this.supportThreshold = supportThreshold;
    }

    public double getMaxUnsupportedRatio() {
        return maxUnsupportedRatio;
    }

    public void setMaxUnsupportedRatio(double maxUnsupportedRatio) {
        this.maxUnsupportedRatio = maxUnsupportedRatio;
    }

    public int getMinCriteriaLength() {
        return minCriteriaLength;
    }

    public void setMinCriteriaLength(int minCriteriaLength) {
        this.minCriteriaLength = minCriteriaLength;
    }
}
