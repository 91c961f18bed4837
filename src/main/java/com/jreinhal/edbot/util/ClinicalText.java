package com.jreinhal.edbot.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercase tokenising and whole-word phrase matching used across classification, scoring and validation.
 */
public final class ClinicalText {
    private static final Pattern QUERY_PUNCTUATION = Pattern.compile("[?!,;:\"()\\[\\]{}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ClinicalText() {
    }

    /**
     * Lowercases, drops sentence punctuation and collapses whitespace. Used for cache keys.
     */
    public static String normalizeQuery(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        lower = QUERY_PUNCTUATION.matcher(lower).replaceAll(" ");
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }

    /**
     * Splits into lowercase word tokens. Hyphens, slashes and decimal points inside a token are kept.
     */
    public static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return out;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            boolean inner = (c == '-' || c == '/' || c == '.') && current.length() > 0
                    && i + 1 < lower.length() && Character.isLetterOrDigit(lower.charAt(i + 1));
            if (Character.isLetterOrDigit(c) || inner) {
                current.append(c);
            } else if (current.length() > 0) {
                out.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    /**
     * Tokens of at least {@code minLength} characters that are not in {@code stopWords}, in order of first appearance.
     */
    public static Set<String> significantTokens(String text, Set<String> stopWords, int minLength) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String token : tokens(text)) {
            if (token.length() >= minLength && !stopWords.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * True when {@code phrase} occurs in {@code lowerText} bounded by non-alphanumeric characters.
     * Both arguments are expected in lowercase.
     */
    public static boolean containsPhrase(String lowerText, String phrase) {
        return countPhrase(lowerText, phrase, 1) > 0;
    }

    public static int countPhrase(String lowerText, String phrase) {
        return countPhrase(lowerText, phrase, Integer.MAX_VALUE);
    }

    private static int countPhrase(String lowerText, String phrase, int limit) {
        if (lowerText == null || phrase == null || phrase.isEmpty() || lowerText.length() < phrase.length()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        while (count < limit) {
            int idx = lowerText.indexOf(phrase, from);
            if (idx < 0) {
                break;
            }
            int end = idx + phrase.length();
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(lowerText.charAt(idx - 1));
            boolean endOk = end == lowerText.length() || !Character.isLetterOrDigit(lowerText.charAt(end));
            if (startOk && endOk) {
                count++;
                from = end;
            } else {
                from = idx + 1;
            }
        }
        return count;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.trim()).length;
    }

    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, Math.max(0, max - 3)) + "...";
    }
}
