package com.jreinhal.edbot.model;

import org.springframework.lang.Nullable;

/**
 * One entry of a pre-computed span index: a character range of a record's text
 * and where it was rendered.
 */
public record SpanBox(OffsetRange range, @Nullable Integer page, @Nullable BBox bbox) {
}
