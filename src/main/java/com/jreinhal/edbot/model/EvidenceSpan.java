package com.jreinhal.edbot.model;

import org.springframework.lang.Nullable;

/**
 * A character range of a source document that backs part of an answer.
 * Offsets are half-open and always lie within the source text.
 */
public record EvidenceSpan(
        String documentId,
        @Nullable Integer page,
        int offsetStart,
        int offsetEnd,
        @Nullable BBox bbox,
        double confidence) {
}
