package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.constant.StopWords;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.rag.scoring.CandidateSelector;
import com.jreinhal.edbot.store.DocumentStore;
import com.jreinhal.edbot.util.ClinicalText;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Tier 3: loosened search over the chunk store. No category filter, a larger result limit, and
 * multi-word terms broken into their individual words.
 */
@Component
public class BestEffortSearchTier implements RetrievalTier {
    private static final Logger log = LoggerFactory.getLogger(BestEffortSearchTier.class);

    @Nullable
    private final DocumentStore documentStore;
    private final CandidateSelector selector;
    private final RetrievalProperties properties;

    public BestEffortSearchTier(@Nullable DocumentStore documentStore, CandidateSelector selector, RetrievalProperties properties) {
        this.documentStore = documentStore;
        this.selector = selector;
        this.properties = properties;
    }

    @Override
    public Tier tier() {
        return Tier.BEST_EFFORT;
    }

    @Override
    public TierResult retrieve(Query query, RetrievalContext context) {
        if (this.documentStore == null) {
            return TierResult.failure(Tier.BEST_EFFORT, TierError.Kind.STORE_UNAVAILABLE, "no document store configured");
        }
        Set<String> terms = looseTerms(query);
        if (terms.isEmpty()) {
            return TierResult.empty(Tier.BEST_EFFORT, "no searchable terms");
        }
        List<KnowledgeRecord> records;
        try {
            records = this.documentStore.searchChunks(terms, null, Math.max(1, this.properties.getBestEffort().getLimit()));
        } catch (RuntimeException e) {
            log.warn("Best-effort chunk search failed: {}", e.getMessage());
            return TierResult.failure(Tier.BEST_EFFORT, TierError.Kind.STORE_FAILURE, "chunk search failed: " + e.getClass().getSimpleName());
        }
        if (context.shouldStop()) {
            return TierResult.empty(Tier.BEST_EFFORT, "deadline reached before scoring");
        }
        Optional<CandidateAnswer> best = this.selector.best(query, records, Tier.BEST_EFFORT);
        return best.map(TierResult::candidate)
                .orElseGet(() -> TierResult.empty(Tier.BEST_EFFORT, "no relevant chunk"));
    }

    static Set<String> looseTerms(Query query) {
        Set<String> terms = new LinkedHashSet<>(query.expandedTerms());
        for (String term : query.expandedTerms()) {
            if (term.indexOf(' ') < 0) {
                continue;
            }
            terms.addAll(ClinicalText.significantTokens(term, StopWords.QUERY_KEYWORDS, 3));
        }
        return terms;
    }
}
