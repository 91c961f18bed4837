package com.jreinhal.edbot.model;

/**
 * The seven sub-scores combined into a candidate's overall confidence. Each is clamped to [0,1].
 */
public record ConfidenceFactors(
        double sourceReliability,
        double contentSpecificity,
        double terminologyMatch,
        double categoryAlignment,
        double informationCompleteness,
        double authorityIndicators,
        double uncertaintyMarkers) {

    public ConfidenceFactors {
        sourceReliability = clamp(sourceReliability);
        contentSpecificity = clamp(contentSpecificity);
        terminologyMatch = clamp(terminologyMatch);
        categoryAlignment = clamp(categoryAlignment);
        informationCompleteness = clamp(informationCompleteness);
        authorityIndicators = clamp(authorityIndicators);
        uncertaintyMarkers = clamp(uncertaintyMarkers);
    }

    public static ConfidenceFactors uniform(double value) {
        return new ConfidenceFactors(value, value, value, value, value, value, value);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
