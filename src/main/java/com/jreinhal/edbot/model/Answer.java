package com.jreinhal.edbot.model;

import java.util.List;

/**
 * Final response for one question. Always produced; the worst case is the safety fallback at tier 4.
 */
public record Answer(
        String text,
        Category category,
        double confidence,
        ConfidenceLevel confidenceLevel,
        int tierUsed,
        List<EvidenceSpan> evidence,
        ValidationSummary validation,
        List<String> sources,
        boolean cached) {

    public Answer {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        confidenceLevel = ConfidenceLevel.of(confidence);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public Answer asCached() {
        return new Answer(text, category, confidence, confidenceLevel, tierUsed, evidence, validation, sources, true);
    }

    public boolean isSafetyFallback() {
        return tierUsed == Tier.SAFETY_FALLBACK.index();
    }
}
