package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.model.ConfidenceFactors;
import com.jreinhal.edbot.model.ConfidenceLevel;

public record ConfidenceAssessment(ConfidenceFactors factors, double confidence, ConfidenceLevel level) {

    public ConfidenceAssessment {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        level = ConfidenceLevel.of(confidence);
    }

    public ConfidenceAssessment(ConfidenceFactors factors, double confidence) {
        this(factors, confidence, null);
    }
}
