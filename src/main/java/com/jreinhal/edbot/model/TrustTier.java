package com.jreinhal.edbot.model;

import java.util.Locale;

/**
 * Trust ranking of the store a record came from. Curated answers outrank
 * structured protocol documents, which outrank generic chunks.
 */
public enum TrustTier {
    CURATED_QA(0.95),
    STRUCTURED_PROTOCOL(0.85),
    GENERIC_CHUNK(0.6);

    private final double baseReliability;

    TrustTier(double baseReliability) {
        this.baseReliability = baseReliability;
    }

    public double baseReliability() {
        return this.baseReliability;
    }

    public static TrustTier fromString(String value, TrustTier fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return TrustTier.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
