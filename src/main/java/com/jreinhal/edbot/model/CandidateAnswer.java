package com.jreinhal.edbot.model;

import java.util.List;

/**
 * The best-scored result of a single tier.
 */
public record CandidateAnswer(
        String text,
        Tier tier,
        List<KnowledgeRecord> sources,
        double relevance,
        ConfidenceFactors factors,
        double confidence,
        ConfidenceLevel level) {

    public CandidateAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        level = ConfidenceLevel.of(confidence);
    }

    public CandidateAnswer(String text, Tier tier, List<KnowledgeRecord> sources, double relevance,
                           ConfidenceFactors factors, double confidence) {
        this(text, tier, sources, relevance, factors, confidence, null);
    }

    public KnowledgeRecord primarySource() {
        return sources.isEmpty() ? null : sources.get(0);
    }
}
