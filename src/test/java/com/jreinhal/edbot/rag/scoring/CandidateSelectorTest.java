package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.model.TrustTier;
import com.jreinhal.edbot.rag.classifier.QueryAnalyzer;
import com.jreinhal.edbot.rag.classifier.QueryClassifier;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.rag.thesaurus.ThesaurusFixtures;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandidateSelectorTest {

    private CandidateSelector selector;
    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        MedicalThesaurus thesaurus = ThesaurusFixtures.bundled();
        selector = new CandidateSelector(new RelevanceScorer(thesaurus), new ConfidenceCalculator(thesaurus), new RetrievalProperties());
        analyzer = new QueryAnalyzer(new QueryClassifier(), thesaurus);
    }

    @Test
    void picksMostConfidentRelevantRecord() {
        Query query = analyzer.analyze("What is the sepsis protocol?");
        KnowledgeRecord weak = KnowledgeRecord.builder("chunk-9")
                .text("Sepsis may sometimes be considered in some patients.")
                .build();
        KnowledgeRecord strong = KnowledgeRecord.builder("kb-sepsis")
                .displayName("Sepsis Protocol")
                .text("Sepsis protocol: Step 1 draw lactate and blood cultures within 1 hour. "
                        + "Step 2 give 30 ml/kg crystalloid. Call the sepsis pager 917-555-0142.")
                .trustTier(TrustTier.CURATED_QA)
                .category(Category.PROTOCOL)
                .storeScore(0.8)
                .build();

        Optional<CandidateAnswer> best = selector.best(query, List.of(weak, strong), Tier.CURATED_KB);

        assertTrue(best.isPresent());
        assertEquals("kb-sepsis", best.get().primarySource().id());
        assertEquals(Tier.CURATED_KB, best.get().tier());
        assertTrue(best.get().relevance() >= 0.4, "store score is blended into relevance");
    }

    @Test
    void irrelevantRecordsProduceNoCandidate() {
        Query query = analyzer.analyze("What is the sepsis protocol?");
        KnowledgeRecord unrelated = KnowledgeRecord.builder("r").text("Cafeteria hours are 7 to 7.").build();

        assertTrue(selector.best(query, List.of(unrelated), Tier.BEST_EFFORT).isEmpty());
    }

    @Test
    void emptyNullAndBlankRecordsAreTolerated() {
        Query query = analyzer.analyze("sepsis");

        assertTrue(selector.best(query, List.of(), Tier.HYBRID_SEARCH).isEmpty());
        assertTrue(selector.best(query, null, Tier.HYBRID_SEARCH).isEmpty());
        assertTrue(selector.best(query, Arrays.asList(null, KnowledgeRecord.builder("b").text(" ").build()), Tier.HYBRID_SEARCH).isEmpty());
    }

    @Test
    void abbreviationQueryFindsFullFormRecord() {
        Query query = analyzer.analyze("DKA management");
        KnowledgeRecord record = KnowledgeRecord.builder("kb-dka")
                .text("Diabetic ketoacidosis management: start insulin infusion at 0.1 units/kg/hr after potassium is checked.")
                .build();

        Optional<CandidateAnswer> best = selector.best(query, List.of(record), Tier.HYBRID_SEARCH);

        assertTrue(best.isPresent());
        assertEquals(1.0, best.get().factors().terminologyMatch(), 1e-9);
    }
}
