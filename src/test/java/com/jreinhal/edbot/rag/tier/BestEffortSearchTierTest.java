package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.store.DocumentStore;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BestEffortSearchTierTest {

    private TierFixtures fixtures;
    private DocumentStore documentStore;
    private BestEffortSearchTier tier;

    @BeforeEach
    void setUp() {
        fixtures = new TierFixtures();
        documentStore = mock(DocumentStore.class);
        tier = new BestEffortSearchTier(documentStore, fixtures.selector, fixtures.properties);
    }

    @Test
    void searchesWithoutCategoryAndWithLargerLimit() {
        Query query = fixtures.analyzer.analyze("hyperkalemia treatment");
        KnowledgeRecord chunk = KnowledgeRecord.builder("c1")
                .text("Hyperkalemia: give calcium gluconate 1 g IV, then insulin 10 units IV with dextrose.")
                .build();
        when(documentStore.searchChunks(anySet(), isNull(), anyInt())).thenReturn(List.of(chunk));

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierResult.Kind.CANDIDATE, result.kind());
        assertEquals(Tier.BEST_EFFORT, result.candidate().orElseThrow().tier());
        verify(documentStore).searchChunks(anySet(), isNull(), eq(fixtures.properties.getBestEffort().getLimit()));
    }

    @Test
    void looseTermsSplitMultiWordTerms() {
        Query query = fixtures.analyzer.analyze("high potassium");

        Set<String> terms = BestEffortSearchTier.looseTerms(query);

        assertTrue(terms.containsAll(query.expandedTerms()));
        assertTrue(terms.contains("hyperkalemia"));
        assertTrue(terms.contains("elevated"));
        assertTrue(terms.contains("potassium"));
    }

    @Test
    void storeFailureIsReported() {
        when(documentStore.searchChunks(anySet(), any(), anyInt())).thenThrow(new IllegalStateException("down"));

        TierResult result = tier.retrieve(fixtures.analyzer.analyze("hyperkalemia"), RetrievalContext.withTimeout(5000));

        assertEquals(TierError.Kind.STORE_FAILURE, result.error().orElseThrow().kind());
    }

    @Test
    void nothingRelevantIsEmpty() {
        when(documentStore.searchChunks(anySet(), any(), anyInt())).thenReturn(List.of());

        assertEquals(TierResult.Kind.EMPTY,
                tier.retrieve(fixtures.analyzer.analyze("hyperkalemia"), RetrievalContext.withTimeout(5000)).kind());
    }

    @Test
    void missingStoreIsUnavailable() {
        BestEffortSearchTier noStore = new BestEffortSearchTier(null, fixtures.selector, fixtures.properties);

        TierResult result = noStore.retrieve(fixtures.analyzer.analyze("hyperkalemia"), RetrievalContext.withTimeout(5000));

        assertEquals(TierError.Kind.STORE_UNAVAILABLE, result.error().orElseThrow().kind());
    }
}
