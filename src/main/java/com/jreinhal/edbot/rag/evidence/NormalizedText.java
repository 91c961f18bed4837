package com.jreinhal.edbot.rag.evidence;

import java.util.Arrays;

/**
 * Immutable normalized view of a text with an exact map from every normalized character back to
 * the original character it came from.
 *
 * <p>Normalization lowercases, turns every run of whitespace or punctuation other than hyphen,
 * underscore and period into one space, and trims. Because each normalized character records its
 * source index, a normalized range that starts and ends on a non-space character maps back to an
 * original range without estimation.</p>
 */
final class NormalizedText {
    private final String original;
    private final String normalized;
    private final int[] sourceIndex;

    private NormalizedText(String original, String normalized, int[] sourceIndex) {
        this.original = original;
        this.normalized = normalized;
        this.sourceIndex = sourceIndex;
    }

    static NormalizedText of(String original) {
        String text = original == null ? "" : original;
        StringBuilder sb = new StringBuilder(text.length());
        int[] index = new int[text.length()];
        int n = 0;
        int pendingSpace = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isKept(c)) {
                if (pendingSpace >= 0 && sb.length() > 0) {
                    sb.append(' ');
                    index[n++] = pendingSpace;
                }
                pendingSpace = -1;
                sb.append(Character.toLowerCase(c));
                index[n++] = i;
            } else if (pendingSpace < 0) {
                pendingSpace = i;
            }
        }
        return new NormalizedText(text, sb.toString(), Arrays.copyOf(index, n));
    }

    static String normalize(String text) {
        return of(text).normalized();
    }

    static boolean isKept(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    String original() {
        return this.original;
    }

    String normalized() {
        return this.normalized;
    }

    int originalLength() {
        return this.original.length();
    }

    int normalizedLength() {
        return this.normalized.length();
    }

    /**
     * Original index of the normalized character at {@code normalizedIndex}.
     */
    int sourceIndexOf(int normalizedIndex) {
        return this.sourceIndex[normalizedIndex];
    }

    /**
     * Length of the original text consumed when normalizing from {@code start} reproduces {@code target},
     * or -1 when it does not.
     */
    int matchLengthAt(int start, String target) {
        if (start < 0 || start >= this.original.length() || target.isEmpty()) {
            return -1;
        }
        int i = start;
        int t = 0;
        if (!isKept(this.original.charAt(i))) {
            return -1;
        }
        while (t < target.length()) {
            if (i >= this.original.length()) {
                return -1;
            }
            char expected = target.charAt(t);
            if (expected == ' ') {
                if (isKept(this.original.charAt(i))) {
                    return -1;
                }
                while (i < this.original.length() && !isKept(this.original.charAt(i))) {
                    i++;
                }
                t++;
                continue;
            }
            char c = this.original.charAt(i);
            if (!isKept(c) || Character.toLowerCase(c) != expected) {
                return -1;
            }
            i++;
            t++;
        }
        return i - start;
    }
}
