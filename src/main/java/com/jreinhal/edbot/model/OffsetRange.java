package com.jreinhal.edbot.model;

/**
 * Half-open character range {@code [start, end)} into a source text.
 */
public record OffsetRange(int start, int end) {

    public OffsetRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public int overlap(OffsetRange other) {
        return Math.max(0, Math.min(end, other.end) - Math.max(start, other.start));
    }
}
