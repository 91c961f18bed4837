package com.jreinhal.edbot.model;

import java.util.List;
import java.util.Locale;

/**
 * Intent of a clinical question.
 */
public enum Category {
    CONTACT,
    FORM,
    PROTOCOL,
    CRITERIA,
    DOSAGE,
    SUMMARY;

    /**
     * Canonical evaluation order used when more than one category has signal.
     */
    public static final List<Category> PRIORITY = List.of(FORM, PROTOCOL, DOSAGE, CRITERIA, CONTACT, SUMMARY);

    public String label() {
        return this.name().toLowerCase(Locale.ROOT);
    }

    public static Category fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.name().equals(v)) {
                return c;
            }
        }
        return null;
    }
}
