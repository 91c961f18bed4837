package com.jreinhal.edbot.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keeps clinical questions and store text out of log lines.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 200;

    private LogSanitizer() {
    }

    /**
     * Length and hash of a question, so requests can be correlated without logging the text itself.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters, folds line breaks and bounds the length of a value before logging it.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            return cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return cleaned;
    }

    /**
     * A score with a fixed number of decimals and a dot separator whatever the default locale.
     */
    public static String score(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
