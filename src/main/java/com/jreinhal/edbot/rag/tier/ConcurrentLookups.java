package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Tier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a tier's independent store lookups on the lookup pool and joins them under the tier deadline.
 * A lookup that times out, fails or is rejected contributes no records and one {@link TierError}.
 * Abandoned lookups are cancelled with interruption so the pool thread is released.
 */
final class ConcurrentLookups {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentLookups.class);

    private ConcurrentLookups() {
    }

    static Outcome run(ExecutorService executor, Tier tier, RetrievalContext context,
                       Map<String, Supplier<List<KnowledgeRecord>>> lookups) {
        Map<String, List<KnowledgeRecord>> results = new LinkedHashMap<>();
        List<TierError> errors = new ArrayList<>();
        Map<String, Future<List<KnowledgeRecord>>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, Supplier<List<KnowledgeRecord>>> entry : lookups.entrySet()) {
            Callable<List<KnowledgeRecord>> task = entry.getValue()::get;
            try {
                futures.put(entry.getKey(), executor.submit(task));
            } catch (RejectedExecutionException e) {
                log.warn("{} lookup '{}' rejected: {}", tier, entry.getKey(), e.getMessage());
                errors.add(new TierError(tier, TierError.Kind.REJECTED, entry.getKey() + " lookup rejected"));
            }
        }
        for (Map.Entry<String, Future<List<KnowledgeRecord>>> entry : futures.entrySet()) {
            String label = entry.getKey();
            Future<List<KnowledgeRecord>> future = entry.getValue();
            long remainingMs = context.remainingMs();
            if (context.isCancelled() || remainingMs <= 0L) {
                future.cancel(true);
                errors.add(new TierError(tier, context.isCancelled() ? TierError.Kind.INTERRUPTED : TierError.Kind.TIMEOUT,
                        label + " lookup abandoned at deadline"));
                continue;
            }
            try {
                List<KnowledgeRecord> records = future.get(remainingMs, TimeUnit.MILLISECONDS);
                results.put(label, records == null ? List.of() : records);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                if (log.isWarnEnabled()) {
                    log.warn("{} lookup '{}' interrupted", tier, label);
                }
                errors.add(new TierError(tier, TierError.Kind.INTERRUPTED, label + " lookup interrupted"));
            } catch (TimeoutException e) {
                future.cancel(true);
                if (log.isWarnEnabled()) {
                    log.warn("{} lookup '{}' timed out (remaining {}ms)", tier, label, remainingMs);
                }
                errors.add(new TierError(tier, TierError.Kind.TIMEOUT, label + " lookup timed out"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (log.isWarnEnabled()) {
                    log.warn("{} lookup '{}' failed: {}", tier, label, cause.getMessage());
                }
                errors.add(new TierError(tier, TierError.Kind.STORE_FAILURE,
                        label + " lookup failed: " + cause.getClass().getSimpleName()));
            }
        }
        return new Outcome(results, errors);
    }

    /**
     * @param results records per lookup label, in submission order, for lookups that completed
     * @param errors one entry per lookup that did not complete
     */
    record Outcome(Map<String, List<KnowledgeRecord>> results, List<TierError> errors) {

        boolean allFailed() {
            return this.results.isEmpty() && !this.errors.isEmpty();
        }

        List<KnowledgeRecord> all() {
            List<KnowledgeRecord> all = new ArrayList<>();
            this.results.values().forEach(all::addAll);
            return all;
        }

        List<KnowledgeRecord> get(String label) {
            return this.results.getOrDefault(label, List.of());
        }

        /**
         * The error that best explains a total failure: a timeout beats other kinds.
         */
        TierError primaryError() {
            return this.errors.stream()
                    .filter(e -> e.kind() == TierError.Kind.TIMEOUT)
                    .findFirst()
                    .orElse(this.errors.get(0));
        }
    }
}
