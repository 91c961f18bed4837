package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.rag.scoring.CandidateSelector;
import com.jreinhal.edbot.store.CuratedKbStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Tier 1: curated question/answer records.
 *
 * <p>The category-filtered lookup and the cross-category lookup run concurrently on the lookup pool;
 * their results are merged by record id, keeping the higher store score.</p>
 */
@Component
public class CuratedKbTier implements RetrievalTier {
    private static final Logger log = LoggerFactory.getLogger(CuratedKbTier.class);

    static final String IN_CATEGORY = "in-category";
    static final String CROSS_CATEGORY = "cross-category";

    @Nullable
    private final CuratedKbStore store;
    private final CandidateSelector selector;
    private final RetrievalProperties properties;
    private final ExecutorService lookupExecutor;

    public CuratedKbTier(@Nullable CuratedKbStore store, CandidateSelector selector, RetrievalProperties properties,
                         @Qualifier("lookupExecutor") ExecutorService lookupExecutor) {
        this.store = store;
        this.selector = selector;
        this.properties = properties;
        this.lookupExecutor = lookupExecutor;
    }

    @Override
    public Tier tier() {
        return Tier.CURATED_KB;
    }

    @Override
    public TierResult retrieve(Query query, RetrievalContext context) {
        if (this.store == null) {
            return TierResult.failure(Tier.CURATED_KB, TierError.Kind.STORE_UNAVAILABLE, "no curated store configured");
        }
        Map<String, Supplier<List<KnowledgeRecord>>> lookups = new LinkedHashMap<>();
        lookups.put(IN_CATEGORY, () -> this.store.lookup(query.expandedTerms(), query.category()));
        lookups.put(CROSS_CATEGORY, () -> this.store.lookup(query.expandedTerms(), null));
        ConcurrentLookups.Outcome outcome = ConcurrentLookups.run(this.lookupExecutor, Tier.CURATED_KB, context, lookups);
        if (outcome.allFailed()) {
            return TierResult.failure(outcome.primaryError());
        }
        if (context.shouldStop()) {
            return TierResult.empty(Tier.CURATED_KB, "deadline reached before scoring");
        }

        List<KnowledgeRecord> records = mergeById(outcome.all());
        int limit = Math.max(1, this.properties.getCuratedKb().getLimit());
        if (records.size() > limit) {
            records = records.subList(0, limit);
        }
        Optional<CandidateAnswer> best = this.selector.best(query, records, Tier.CURATED_KB);
        if (log.isDebugEnabled()) {
            log.debug("Curated KB: {} record(s), {} lookup error(s)", records.size(), outcome.errors().size());
        }
        return best.map(TierResult::candidate)
                .orElseGet(() -> TierResult.empty(Tier.CURATED_KB, "no relevant curated record"));
    }

    /**
     * Distinct records by id, highest store score first.
     */
    static List<KnowledgeRecord> mergeById(List<KnowledgeRecord> records) {
        Map<String, KnowledgeRecord> byId = new LinkedHashMap<>();
        for (KnowledgeRecord record : records) {
            if (record == null) {
                continue;
            }
            byId.merge(record.id(), record, (a, b) -> b.storeScore() > a.storeScore() ? b : a);
        }
        List<KnowledgeRecord> merged = new ArrayList<>(byId.values());
        merged.sort(Comparator.comparingDouble(KnowledgeRecord::storeScore).reversed());
        return merged;
    }
}
