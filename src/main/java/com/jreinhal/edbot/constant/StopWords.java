package com.jreinhal.edbot.constant;

import java.util.Set;

public final class StopWords {
    /**
     * Words dropped when extracting search keywords from a question.
     */
    public static final Set<String> QUERY_KEYWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "tell", "me", "about", "describe",
            "find", "show", "give", "also", "i", "my", "our", "do", "does",
            "can", "need", "get", "please", "this", "that", "there", "it"
    );

    /**
     * Words ignored when checking whether an answer statement is supported by its sources.
     */
    public static final Set<String> GROUNDING = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "shall", "can", "and", "but", "or",
            "nor", "for", "yet", "so", "as", "if", "when", "where", "what", "which",
            "who", "whom", "whose", "why", "how", "that", "this", "these", "those",
            "then", "than", "in", "on", "at", "by", "with", "about", "into", "through",
            "during", "before", "after", "above", "below", "to", "from", "up", "down",
            "out", "off", "over", "under", "again", "further", "all", "each", "few",
            "more", "most", "other", "some", "such", "no", "not", "only", "own",
            "same", "any", "both", "just", "per", "via", "its", "their", "there",
            "you", "your", "also", "use", "used"
    );

    /**
     * Words too generic to count as a concept of the question.
     */
    public static final Set<String> CONCEPT_NOISE = Set.of(
            "what", "show", "tell", "give", "find", "where", "when", "which",
            "about", "protocol", "form", "please", "there", "does", "should",
            "with", "from", "that", "this", "have", "need", "information"
    );

    private StopWords() {
    }
}
