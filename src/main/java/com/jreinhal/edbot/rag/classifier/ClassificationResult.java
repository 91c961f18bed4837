package com.jreinhal.edbot.rag.classifier;

import com.jreinhal.edbot.model.Category;
import java.util.List;
import java.util.Map;

/**
 * @param evidence patterns and keywords that fired for the winning category
 * @param scores capped score of every category, for diagnostics
 */
public record ClassificationResult(Category category, double confidence, List<String> evidence, Map<Category, Double> scores) {

    public ClassificationResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }
}
