package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.rag.scoring.CandidateSelector;
import com.jreinhal.edbot.store.DocumentStore;
import com.jreinhal.edbot.util.LogSanitizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Tier 2: lexical chunk search and vector similarity search, fused by reciprocal rank.
 *
 * <p>Both searches run concurrently. Without a {@link VectorStore} the tier is lexical only;
 * the fused list is then just the lexical ranking.</p>
 */
@Component
public class HybridSearchTier implements RetrievalTier {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchTier.class);

    static final String LEXICAL = "lexical";
    static final String SEMANTIC = "semantic";

    @Nullable
    private final DocumentStore documentStore;
    @Nullable
    private final VectorStore vectorStore;
    private final CandidateSelector selector;
    private final RetrievalProperties properties;
    private final ExecutorService lookupExecutor;

    public HybridSearchTier(@Nullable DocumentStore documentStore, @Nullable VectorStore vectorStore,
                            CandidateSelector selector, RetrievalProperties properties,
                            @Qualifier("lookupExecutor") ExecutorService lookupExecutor) {
        this.documentStore = documentStore;
        this.vectorStore = vectorStore;
        this.selector = selector;
        this.properties = properties;
        this.lookupExecutor = lookupExecutor;
    }

    @Override
    public Tier tier() {
        return Tier.HYBRID_SEARCH;
    }

    @Override
    public TierResult retrieve(Query query, RetrievalContext context) {
        int limit = Math.max(1, this.properties.getHybridSearch().getLimit());
        Map<String, Supplier<List<KnowledgeRecord>>> lookups = new LinkedHashMap<>();
        if (this.documentStore != null) {
            lookups.put(LEXICAL, () -> this.documentStore.searchChunks(query.expandedTerms(), query.category(), limit));
        }
        if (this.vectorStore != null) {
            lookups.put(SEMANTIC, () -> this.semanticSearch(query));
        }
        if (lookups.isEmpty()) {
            return TierResult.failure(Tier.HYBRID_SEARCH, TierError.Kind.STORE_UNAVAILABLE, "no document or vector store configured");
        }

        ConcurrentLookups.Outcome outcome = ConcurrentLookups.run(this.lookupExecutor, Tier.HYBRID_SEARCH, context, lookups);
        if (outcome.allFailed()) {
            return TierResult.failure(outcome.primaryError());
        }
        if (context.shouldStop()) {
            return TierResult.empty(Tier.HYBRID_SEARCH, "deadline reached before scoring");
        }

        List<KnowledgeRecord> fused = fuse(outcome.get(SEMANTIC), outcome.get(LEXICAL), this.properties.getRrfK(),
                this.properties.getSemanticWeight(), this.properties.getKeywordWeight(), limit);
        Optional<CandidateAnswer> best = this.selector.best(query, fused, Tier.HYBRID_SEARCH);
        log.info("Hybrid search for {}: {} lexical, {} semantic, {} fused",
                LogSanitizer.querySummary(query.raw()), outcome.get(LEXICAL).size(), outcome.get(SEMANTIC).size(), fused.size());
        return best.map(TierResult::candidate)
                .orElseGet(() -> TierResult.empty(Tier.HYBRID_SEARCH, "no relevant chunk"));
    }

    private List<KnowledgeRecord> semanticSearch(Query query) {
        RetrievalProperties.Vector vector = this.properties.getVector();
        List<Document> documents = this.vectorStore.similaritySearch(SearchRequest.builder()
                .query(query.raw())
                .topK(Math.max(1, vector.getTopK()))
                .similarityThreshold(vector.getSimilarityThreshold())
                .build());
        if (documents == null) {
            return List.of();
        }
        return documents.stream()
                .filter(Objects::nonNull)
                .map(VectorRecordMapper::toRecord)
                .collect(Collectors.toList());
    }

    /**
     * Reciprocal-rank fusion: each list contributes {@code weight / (k + rank)} per record, ranks
     * starting at 1. Records are identified by document and text, so the same chunk returned by both
     * searches is counted once.
     */
    static List<KnowledgeRecord> fuse(List<KnowledgeRecord> semantic, List<KnowledgeRecord> lexical, int k,
                                      double semanticWeight, double keywordWeight, int limit) {
        Map<String, Double> rrfScores = new HashMap<>();
        Map<String, KnowledgeRecord> byKey = new HashMap<>();
        accumulate(semantic, semanticWeight, k, rrfScores, byKey);
        accumulate(lexical, keywordWeight, k, rrfScores, byKey);
        List<Map.Entry<String, Double>> sorted = new ArrayList<>(rrfScores.entrySet());
        sorted.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        return sorted.stream()
                .limit(Math.max(1, limit))
                .map(e -> byKey.get(e.getKey()))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static void accumulate(List<KnowledgeRecord> ranked, double weight, int k,
                                   Map<String, Double> rrfScores, Map<String, KnowledgeRecord> byKey) {
        int rank = 0;
        for (KnowledgeRecord record : ranked) {
            if (record == null) {
                continue;
            }
            rank++;
            String key = fusionKey(record);
            rrfScores.merge(key, weight / (double) (k + rank), Double::sum);
            byKey.merge(key, record, (a, b) -> b.storeScore() > a.storeScore() ? b : a);
        }
    }

    private static String fusionKey(KnowledgeRecord record) {
        return record.documentId() + "_" + record.text().hashCode();
    }
}
