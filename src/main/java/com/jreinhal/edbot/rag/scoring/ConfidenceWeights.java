package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ConfidenceFactors;

/**
 * Weights of the seven confidence factors. Category overrides may total more than 1.0, which lifts
 * strong candidates in that category; {@link #combine} clips the weighted sum to [0, 1].
 */
public record ConfidenceWeights(
        double reliability,
        double specificity,
        double terminology,
        double alignment,
        double completeness,
        double authority,
        double uncertainty) {

    public static final ConfidenceWeights DEFAULT = new ConfidenceWeights(0.25, 0.20, 0.15, 0.15, 0.10, 0.10, 0.05);

    public static ConfidenceWeights forCategory(Category category) {
        if (category == null) {
            return DEFAULT;
        }
        return switch (category) {
            case DOSAGE -> new ConfidenceWeights(0.25, 0.30, 0.15, 0.15, 0.10, 0.15, 0.05);
            case CONTACT -> new ConfidenceWeights(0.25, 0.25, 0.15, 0.25, 0.10, 0.10, 0.05);
            case PROTOCOL -> new ConfidenceWeights(0.30, 0.20, 0.15, 0.15, 0.10, 0.15, 0.05);
            default -> DEFAULT;
        };
    }

    public double total() {
        return reliability + specificity + terminology + alignment + completeness + authority + uncertainty;
    }

    public double combine(ConfidenceFactors f) {
        double sum = reliability * f.sourceReliability()
                + specificity * f.contentSpecificity()
                + terminology * f.terminologyMatch()
                + alignment * f.categoryAlignment()
                + completeness * f.informationCompleteness()
                + authority * f.authorityIndicators()
                + uncertainty * f.uncertaintyMarkers();
        return Math.max(0.0, Math.min(1.0, sum));
    }
}
