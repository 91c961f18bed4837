package com.jreinhal.edbot.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 0.8) {
            return HIGH;
        }
        if (confidence >= 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
