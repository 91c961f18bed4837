package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.util.LogSanitizer;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks a tier's single best candidate from the records its store returned.
 * Records with no lexical relevance are dropped; the rest are ranked by confidence,
 * then by blended relevance.
 */
@Component
public class CandidateSelector {
    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    private final RelevanceScorer relevanceScorer;
    private final ConfidenceCalculator confidenceCalculator;
    private final RetrievalProperties properties;

    public CandidateSelector(RelevanceScorer relevanceScorer, ConfidenceCalculator confidenceCalculator, RetrievalProperties properties) {
        this.relevanceScorer = relevanceScorer;
        this.confidenceCalculator = confidenceCalculator;
        this.properties = properties;
    }

    public Optional<CandidateAnswer> best(Query query, List<KnowledgeRecord> records, Tier tier) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        CandidateAnswer best = null;
        int considered = 0;
        for (KnowledgeRecord record : records) {
            if (record == null || record.text().isBlank()) {
                continue;
            }
            double lexical = this.relevanceScorer.relevance(query, record.text());
            if (lexical <= this.properties.getMinRelevance()) {
                continue;
            }
            considered++;
            double relevance = record.storeScore() > 0.0 ? 0.5 * record.storeScore() + 0.5 * lexical : lexical;
            ConfidenceAssessment assessment = this.confidenceCalculator.assess(query, record);
            CandidateAnswer candidate = new CandidateAnswer(record.text(), tier, List.of(record), relevance,
                    assessment.factors(), assessment.confidence());
            if (best == null || isBetter(candidate, best)) {
                best = candidate;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Tier {}: {} of {} record(s) relevant; best confidence {}", tier, considered, records.size(),
                    best == null ? "n/a" : LogSanitizer.score(best.confidence(), 3));
        }
        return Optional.ofNullable(best);
    }

    private static boolean isBetter(CandidateAnswer a, CandidateAnswer b) {
        int byConfidence = Double.compare(a.confidence(), b.confidence());
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        return a.relevance() > b.relevance();
    }
}
