package com.jreinhal.edbot.model;

public enum Verdict {
    VALID,
    NEEDS_REVIEW,
    INVALID
}
