package com.jreinhal.edbot.rag.classifier;

import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.util.ClinicalText;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Turns raw question text into an immutable {@link Query}: classify first, then expand with the detected category.
 */
@Component
public class QueryAnalyzer {
    private final QueryClassifier classifier;
    private final MedicalThesaurus thesaurus;

    public QueryAnalyzer(QueryClassifier classifier, MedicalThesaurus thesaurus) {
        this.classifier = classifier;
        this.thesaurus = thesaurus;
    }

    public Query analyze(String text) {
        ClassificationResult classification = this.classifier.classify(text);
        Set<String> expanded = this.thesaurus.expand(text, classification.category());
        return new Query(text == null ? "" : text, ClinicalText.normalizeQuery(text), classification.category(),
                classification.confidence(), expanded, classification.evidence());
    }
}
