package com.jreinhal.edbot.model;

/**
 * Retrieval strategies in cascade order. The ordinal is the {@code tier_used} value reported to callers.
 */
public enum Tier {
    DIRECT_LOOKUP(0.80, 5000L),
    CURATED_KB(0.70, 5000L),
    HYBRID_SEARCH(0.60, 15000L),
    BEST_EFFORT(0.50, 10000L),
    SAFETY_FALLBACK(0.0, 0L);

    private final double defaultThreshold;
    private final long defaultTimeoutMs;

    Tier(double defaultThreshold, long defaultTimeoutMs) {
        this.defaultThreshold = defaultThreshold;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public int index() {
        return this.ordinal();
    }

    public double defaultThreshold() {
        return this.defaultThreshold;
    }

    public long defaultTimeoutMs() {
        return this.defaultTimeoutMs;
    }

    public boolean isTerminal() {
        return this == SAFETY_FALLBACK;
    }
}
