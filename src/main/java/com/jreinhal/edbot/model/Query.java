package com.jreinhal.edbot.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A classified and expanded clinical question. Immutable once built.
 *
 * @param raw text as received
 * @param normalized lowercased, whitespace-collapsed text used for cache keys and matching
 * @param category detected intent
 * @param classificationConfidence classifier confidence in [0,1]
 * @param expandedTerms lowercased terms: the normalized query, abbreviation expansions and synonyms
 * @param classificationEvidence indicator patterns that fired for the winning category
 */
public record Query(
        String raw,
        String normalized,
        Category category,
        double classificationConfidence,
        Set<String> expandedTerms,
        List<String> classificationEvidence) {

    public Query {
        expandedTerms = expandedTerms == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(expandedTerms));
        classificationEvidence = classificationEvidence == null ? List.of() : List.copyOf(classificationEvidence);
    }
}
