package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.DocumentRef;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.store.FormIndex;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class DirectLookupTierTest {

    private TierFixtures fixtures;
    private FormIndex formIndex;
    private DirectLookupTier tier;

    @BeforeEach
    void setUp() {
        fixtures = new TierFixtures();
        formIndex = mock(FormIndex.class);
        tier = new DirectLookupTier(formIndex, fixtures.relevanceScorer, fixtures.confidenceCalculator);
    }

    @Test
    void formRequestResolvesToBestMatchingDocument() {
        Query query = fixtures.analyzer.analyze("show me the blood transfusion consent form");
        when(formIndex.resolve(anyList())).thenReturn(List.of(
                new DocumentRef("MSHS_Consent_General.pdf", "General Consent", "consent"),
                new DocumentRef("MSHS_Consent_for_Elective_Blood_Transfusion.pdf", "Blood Transfusion Consent Form", "blood transfusion")));

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierResult.Kind.CANDIDATE, result.kind());
        CandidateAnswer candidate = result.candidate().orElseThrow();
        assertEquals(Tier.DIRECT_LOOKUP, candidate.tier());
        assertEquals(0.9, candidate.confidence(), 1e-9);
        KnowledgeRecord source = candidate.primarySource();
        assertEquals("MSHS_Consent_for_Elective_Blood_Transfusion.pdf", source.documentId());
        assertEquals("form", source.contentType());
        assertTrue(candidate.text().contains("Blood Transfusion Consent Form"));
    }

    @Test
    void keywordsIncludeWholeQuestionAndExpandedTerms() {
        Query query = fixtures.analyzer.analyze("show me the blood transfusion consent form");

        List<String> keywords = DirectLookupTier.keywords(query);

        assertEquals(query.normalized(), keywords.get(0));
        assertTrue(keywords.containsAll(query.expandedTerms()));
    }

    @Test
    void nonFormQuestionsSkipTheIndex() {
        Query query = fixtures.analyzer.analyze("What is the STEMI protocol?");

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierResult.Kind.EMPTY, result.kind());
        verifyNoInteractions(formIndex);
    }

    @Test
    void noMatchIsEmpty() {
        Query query = fixtures.analyzer.analyze("show me the blood transfusion consent form");
        when(formIndex.resolve(anyList())).thenReturn(List.of());

        assertEquals(TierResult.Kind.EMPTY, tier.retrieve(query, RetrievalContext.withTimeout(5000)).kind());
    }

    @Test
    void indexFailureIsReportedNotThrown() {
        Query query = fixtures.analyzer.analyze("show me the blood transfusion consent form");
        when(formIndex.resolve(anyList())).thenThrow(new IllegalStateException("index offline"));

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertTrue(result.isFailure());
        assertEquals(TierError.Kind.STORE_FAILURE, result.error().orElseThrow().kind());
    }

    @Test
    void missingIndexIsUnavailable() {
        DirectLookupTier noIndex = new DirectLookupTier(null, fixtures.relevanceScorer, fixtures.confidenceCalculator);
        Query query = fixtures.analyzer.analyze("show me the blood transfusion consent form");

        TierResult result = noIndex.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierError.Kind.STORE_UNAVAILABLE, result.error().orElseThrow().kind());
        assertFalse(result.error().get().countsAsStoreFailure());
    }
}
