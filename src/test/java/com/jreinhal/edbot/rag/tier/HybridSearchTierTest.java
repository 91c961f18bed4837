package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.TrustTier;
import com.jreinhal.edbot.store.DocumentStore;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class HybridSearchTierTest {

    private static final String SEPSIS_TEXT = "Sepsis bundle: draw lactate and blood cultures, then give broad spectrum antibiotics "
            + "within 1 hour. Give 30 ml/kg crystalloid for hypotension.";

    private TierFixtures fixtures;
    private DocumentStore documentStore;
    private VectorStore vectorStore;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        fixtures = new TierFixtures();
        documentStore = mock(DocumentStore.class);
        vectorStore = mock(VectorStore.class);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void lexicalAndSemanticResultsAreFused() {
        Query query = fixtures.analyzer.analyze("sepsis antibiotics timing");
        when(documentStore.searchChunks(anySet(), any(), anyInt())).thenReturn(List.of(chunk("doc-a", SEPSIS_TEXT)));
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                Document.builder().id("vec-1").text(SEPSIS_TEXT)
                        .metadata(Map.of("document_id", "doc-a", "source", "Sepsis Guideline.pdf", "page_number", 4))
                        .score(0.82).build()));
        HybridSearchTier tier = new HybridSearchTier(documentStore, vectorStore, fixtures.selector, fixtures.properties, executor);

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierResult.Kind.CANDIDATE, result.kind());
        KnowledgeRecord source = result.candidate().orElseThrow().primarySource();
        assertEquals("doc-a", source.documentId());
        assertEquals(0.82, source.storeScore(), 1e-9, "the copy with the higher store score is kept");
        assertEquals(4, source.page());

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(request.capture());
        assertEquals(query.raw(), request.getValue().getQuery());
        assertEquals(fixtures.properties.getVector().getTopK(), request.getValue().getTopK());
        verify(documentStore).searchChunks(query.expandedTerms(), query.category(), fixtures.properties.getHybridSearch().getLimit());
    }

    @Test
    void worksLexicalOnlyWithoutVectorStore() {
        Query query = fixtures.analyzer.analyze("sepsis antibiotics timing");
        when(documentStore.searchChunks(anySet(), any(), anyInt())).thenReturn(List.of(chunk("doc-a", SEPSIS_TEXT)));
        HybridSearchTier tier = new HybridSearchTier(documentStore, null, fixtures.selector, fixtures.properties, executor);

        assertEquals(TierResult.Kind.CANDIDATE, tier.retrieve(query, RetrievalContext.withTimeout(5000)).kind());
    }

    @Test
    void failingLexicalSearchFallsBackToSemantic() {
        Query query = fixtures.analyzer.analyze("sepsis antibiotics timing");
        when(documentStore.searchChunks(anySet(), any(), anyInt())).thenThrow(new IllegalStateException("index down"));
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                Document.builder().id("vec-1").text(SEPSIS_TEXT).metadata(Map.of("source", "Sepsis.pdf")).score(0.7).build()));
        HybridSearchTier tier = new HybridSearchTier(documentStore, vectorStore, fixtures.selector, fixtures.properties, executor);

        TierResult result = tier.retrieve(query, RetrievalContext.withTimeout(5000));

        assertEquals(TierResult.Kind.CANDIDATE, result.kind());
        assertEquals("Sepsis.pdf", result.candidate().orElseThrow().primarySource().documentId());
    }

    @Test
    void noStoresConfiguredIsUnavailable() {
        HybridSearchTier tier = new HybridSearchTier(null, null, fixtures.selector, fixtures.properties, executor);

        TierResult result = tier.retrieve(fixtures.analyzer.analyze("sepsis"), RetrievalContext.withTimeout(5000));

        assertEquals(TierError.Kind.STORE_UNAVAILABLE, result.error().orElseThrow().kind());
    }

    @Test
    void fusionRanksRecordsFoundByBothSearchesFirst() {
        KnowledgeRecord both = chunk("doc-both", "shared text");
        KnowledgeRecord semanticOnly = chunk("doc-sem", "semantic text");
        KnowledgeRecord lexicalOnly = chunk("doc-lex", "lexical text");

        List<KnowledgeRecord> fused = HybridSearchTier.fuse(
                List.of(semanticOnly, both), List.of(lexicalOnly, both), 60, 0.6, 0.4, 10);

        assertEquals(3, fused.size());
        assertEquals("doc-both", fused.get(0).documentId());
        assertEquals("doc-sem", fused.get(1).documentId(), "semantic weight is higher at equal rank");
        assertEquals("doc-lex", fused.get(2).documentId());
    }

    @Test
    void fusionRespectsLimit() {
        List<KnowledgeRecord> lexical = List.of(chunk("a", "one"), chunk("b", "two"), chunk("c", "three"));

        assertEquals(2, HybridSearchTier.fuse(List.of(), lexical, 60, 0.6, 0.4, 2).size());
    }

    @Test
    void vectorMetadataIsMappedOntoRecord() {
        Document document = Document.builder().id("vec-9").text("Ottawa ankle rules")
                .metadata(Map.of("source", "Ottawa.pdf", "page_number", "7", "category", "criteria", "trust_tier", "structured_protocol"))
                .build();

        KnowledgeRecord record = VectorRecordMapper.toRecord(document);

        assertEquals("vec-9", record.id());
        assertEquals("Ottawa.pdf", record.documentId());
        assertEquals(7, record.page());
        assertEquals(Category.CRITERIA, record.category());
        assertEquals(TrustTier.STRUCTURED_PROTOCOL, record.trustTier());
        assertEquals(0.0, record.storeScore());
        assertEquals("semantic", record.metadata().get("retrieval"));
    }

    private static KnowledgeRecord chunk(String documentId, String text) {
        return KnowledgeRecord.builder(documentId + "#0").documentId(documentId).text(text).build();
    }
}
