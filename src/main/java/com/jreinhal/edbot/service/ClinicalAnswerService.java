package com.jreinhal.edbot.service;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.Answer;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ConfidenceLevel;
import com.jreinhal.edbot.model.EvidenceSpan;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.model.ValidationResult;
import com.jreinhal.edbot.model.ValidationSummary;
import com.jreinhal.edbot.model.Verdict;
import com.jreinhal.edbot.rag.cache.ResponseCachePolicy;
import com.jreinhal.edbot.rag.classifier.QueryAnalyzer;
import com.jreinhal.edbot.rag.evidence.EvidenceMapper;
import com.jreinhal.edbot.rag.grounding.GroundednessValidator;
import com.jreinhal.edbot.rag.tier.RetrievalContext;
import com.jreinhal.edbot.rag.tier.RetrievalTier;
import com.jreinhal.edbot.rag.tier.SafetyFallbackTemplates;
import com.jreinhal.edbot.rag.tier.TierError;
import com.jreinhal.edbot.rag.tier.TierResult;
import com.jreinhal.edbot.store.ResponseCache;
import com.jreinhal.edbot.util.LogSanitizer;
import com.jreinhal.edbot.util.TierCircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Answers a clinical question through the retrieval cascade.
 *
 * Flow per question:
 * - classify and expand, then consult the response cache
 * - run tiers in order; each call is bounded by its own timeout and by the request deadline
 * - the first candidate at or above its tier threshold goes to the groundedness validator
 * - an invalid verdict buys exactly one attempt at the next tier, then the safety fallback
 * - evidence spans are attached to the accepted answer, which is cached asynchronously when allowed
 *
 * {@link #answer(String)} never throws. Every failure ends in a degraded {@link Answer}, at worst
 * the safety fallback at tier 4 with confidence 0.
 */
@Service
public class ClinicalAnswerService {
    private static final Logger log = LoggerFactory.getLogger(ClinicalAnswerService.class);

    static final String EXHAUSTED = "no retrieval tier produced an acceptable answer";
    static final String DEADLINE_EXCEEDED = "request deadline exceeded";
    static final String EMPTY_QUESTION = "empty question";

    private final QueryAnalyzer queryAnalyzer;
    private final List<RetrievalTier> tiers;
    private final GroundednessValidator validator;
    private final EvidenceMapper evidenceMapper;
    private final ResponseCachePolicy cachePolicy;
    @Nullable
    private final ResponseCache responseCache;
    private final SafetyFallbackTemplates safetyTemplates;
    private final RetrievalProperties properties;
    private final ExecutorService tierExecutor;
    private final Map<Tier, TierCircuitBreaker> breakers = new EnumMap<>(Tier.class);

    public ClinicalAnswerService(QueryAnalyzer queryAnalyzer, List<RetrievalTier> tiers, GroundednessValidator validator,
                                 EvidenceMapper evidenceMapper, ResponseCachePolicy cachePolicy,
                                 @Nullable ResponseCache responseCache, SafetyFallbackTemplates safetyTemplates,
                                 RetrievalProperties properties, @Qualifier("tierExecutor") ExecutorService tierExecutor) {
        this.queryAnalyzer = queryAnalyzer;
        this.tiers = tiers.stream()
                .filter(t -> !t.tier().isTerminal())
                .sorted(Comparator.comparingInt(t -> t.tier().index()))
                .collect(Collectors.toList());
        this.validator = validator;
        this.evidenceMapper = evidenceMapper;
        this.cachePolicy = cachePolicy;
        this.responseCache = responseCache;
        this.safetyTemplates = safetyTemplates;
        this.properties = properties;
        this.tierExecutor = tierExecutor;
        RetrievalProperties.CircuitBreaker cb = properties.getCircuitBreaker();
        for (RetrievalTier tier : this.tiers) {
            this.breakers.put(tier.tier(), new TierCircuitBreaker(tier.tier().name(), cb.getFailureThreshold(),
                    Duration.ofSeconds(cb.getOpenSeconds())));
        }
        log.info("Answer cascade ready with tiers {}", this.tiers.stream().map(t -> t.tier().name()).collect(Collectors.toList()));
    }

    public Answer answer(String question) {
        long start = System.currentTimeMillis();
        String summary = LogSanitizer.querySummary(question);
        if (question == null || question.isBlank()) {
            return this.safetyAnswer(Category.SUMMARY, List.of(EMPTY_QUESTION));
        }
        RetrievalContext request = RetrievalContext.withTimeout(this.properties.getRequestTimeoutMs());
        Category category = Category.SUMMARY;
        try {
            Query query = this.queryAnalyzer.analyze(question);
            category = query.category();
            if (log.isDebugEnabled()) {
                log.debug("Query {} classified as {} ({}), {} expanded term(s)", summary, query.category(),
                        LogSanitizer.score(query.classificationConfidence(), 2), query.expandedTerms().size());
            }

            Optional<Answer> cached = this.lookupCache(query);
            if (cached.isPresent()) {
                log.info("Answered {} from response cache (category={})", summary, category);
                return cached.get();
            }

            Answer answer = this.runCascade(query, request);
            this.storeAsync(query, answer);
            log.info("Answered {} category={} tier={} confidence={} verdict={} in {}ms", summary, answer.category(),
                    answer.tierUsed(), LogSanitizer.score(answer.confidence(), 2),
                    answer.validation().verdict(), System.currentTimeMillis() - start);
            return answer;
        } catch (RuntimeException e) {
            log.error("Answer pipeline failed for {}: {}", summary, e.getMessage(), e);
            return this.safetyAnswer(category, List.of("internal error: " + e.getClass().getSimpleName()));
        } finally {
            request.cancel();
        }
    }

    private Answer runCascade(Query query, RetrievalContext request) {
        List<String> issues = new ArrayList<>();
        boolean retryGranted = false;
        boolean rejected = false;
        for (RetrievalTier tier : this.tiers) {
            if (request.shouldStop()) {
                issues.add(DEADLINE_EXCEEDED);
                return this.safetyAnswer(query.category(), issues, rejected);
            }
            boolean isRetry = retryGranted;
            TierResult result = this.callTier(tier, query, request);
            if (Thread.currentThread().isInterrupted()) {
                issues.add("answer interrupted");
                return this.safetyAnswer(query.category(), issues, rejected);
            }

            switch (result.kind()) {
                case CANDIDATE -> {
                    CandidateAnswer candidate = result.candidate().orElseThrow();
                    double threshold = this.properties.settingsFor(tier.tier()).getThreshold();
                    if (candidate.confidence() < threshold) {
                        if (log.isDebugEnabled()) {
                            log.debug("Tier {} candidate below threshold ({} < {})", tier.tier(),
                                    LogSanitizer.score(candidate.confidence(), 3), threshold);
                        }
                        break;
                    }
                    ValidationResult validation = this.validator.validate(query.category(), query.normalized(), candidate);
                    if (validation.verdict() != Verdict.INVALID) {
                        return this.accept(query, candidate, validation);
                    }
                    log.warn("Tier {} candidate rejected by validation: {}", tier.tier(), validation.hardIssues());
                    rejected = true;
                    for (String issue : validation.hardIssues()) {
                        issues.add(tier.tier().name().toLowerCase(Locale.ROOT) + ": " + issue);
                    }
                    if (isRetry) {
                        return this.safetyAnswer(query.category(), withExhaustion(issues), rejected);
                    }
                    retryGranted = true;
                    continue;
                }
                case FAILURE -> {
                    TierError error = result.error().orElseThrow();
                    if (error.kind() != TierError.Kind.STORE_UNAVAILABLE) {
                        issues.add(tier.tier().name().toLowerCase(Locale.ROOT) + " unavailable: " + error.kind());
                    }
                }
                case EMPTY -> {
                    if (log.isDebugEnabled()) {
                        log.debug("Tier {} returned no candidate: {}", tier.tier(), result.reason());
                    }
                }
            }
            if (isRetry) {
                return this.safetyAnswer(query.category(), withExhaustion(issues), rejected);
            }
        }
        if (request.shouldStop()) {
            issues.add(DEADLINE_EXCEEDED);
        }
        return this.safetyAnswer(query.category(), withExhaustion(issues), rejected);
    }

    /**
     * Runs one tier on the tier pool, bounded by the tier timeout and the request deadline.
     */
    TierResult callTier(RetrievalTier tier, Query query, RetrievalContext request) {
        Tier id = tier.tier();
        RetrievalContext tierContext = request.forTier(this.properties.settingsFor(id).getTimeoutMs());
        long waitMs = tierContext.remainingMs();
        if (waitMs <= 0L) {
            return TierResult.failure(id, TierError.Kind.TIMEOUT, "no time left for tier");
        }
        TierCircuitBreaker breaker = this.breakers.get(id);
        if (breaker != null && !breaker.tryAcquire()) {
            return TierResult.failure(id, TierError.Kind.CIRCUIT_OPEN, "circuit open");
        }

        TierResult result;
        Future<TierResult> future = null;
        try {
            future = this.tierExecutor.submit(() -> tier.retrieve(query, tierContext));
            TierResult returned = future.get(waitMs, TimeUnit.MILLISECONDS);
            result = returned != null ? returned : TierResult.empty(id, "tier returned nothing");
        } catch (RejectedExecutionException e) {
            log.warn("Tier {} rejected by executor: {}", id, e.getMessage());
            result = TierResult.failure(id, TierError.Kind.REJECTED, "tier executor overloaded");
        } catch (TimeoutException e) {
            tierContext.cancel();
            future.cancel(true);
            log.warn("Tier {} timed out after {}ms", id, waitMs);
            result = TierResult.failure(id, TierError.Kind.TIMEOUT, "tier timed out after " + waitMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tierContext.cancel();
            future.cancel(true);
            log.warn("Tier {} interrupted", id);
            result = TierResult.failure(id, TierError.Kind.INTERRUPTED, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Tier {} failed: {}", id, cause.getMessage());
            result = TierResult.failure(id, TierError.Kind.STORE_FAILURE, cause.getClass().getSimpleName());
        }

        if (breaker != null) {
            recordOutcome(breaker, result, request);
        }
        return result;
    }

    private static void recordOutcome(TierCircuitBreaker breaker, TierResult result, RetrievalContext request) {
        if (!result.isFailure()) {
            breaker.onSuccess();
            return;
        }
        TierError error = result.error().orElseThrow();
        if (error.countsAsStoreFailure() && !request.isExpired()) {
            breaker.onFailure();
        } else {
            breaker.releaseProbe();
        }
    }

    private Answer accept(Query query, CandidateAnswer candidate, ValidationResult validation) {
        List<EvidenceSpan> evidence = List.of();
        // form answers are built from the index entry, not from document text
        if (candidate.tier() != Tier.DIRECT_LOOKUP) {
            try {
                evidence = this.evidenceMapper.map(candidate.text(), candidate.sources());
            } catch (RuntimeException e) {
                log.warn("Evidence mapping failed; answering without evidence: {}", e.getMessage());
            }
        }
        List<String> sources = candidate.sources().stream()
                .map(KnowledgeRecord::displayName)
                .distinct()
                .collect(Collectors.toList());
        if (!validation.safetyFlags().isEmpty()) {
            log.info("Answer from tier {} carries safety flags {}", candidate.tier(), validation.safetyFlags());
        }
        return new Answer(candidate.text(), query.category(), candidate.confidence(), ConfidenceLevel.of(candidate.confidence()),
                candidate.tier().index(), evidence, validation.summary(), sources, false);
    }

    Answer safetyAnswer(Category category, List<String> issues) {
        return this.safetyAnswer(category, issues, false);
    }

    /**
     * @param rejected whether a candidate failed validation on the way here; the fallback then reports {@link Verdict#INVALID}
     */
    Answer safetyAnswer(Category category, List<String> issues, boolean rejected) {
        Category effective = category != null ? category : Category.SUMMARY;
        Verdict verdict = rejected ? Verdict.INVALID : Verdict.NEEDS_REVIEW;
        return new Answer(this.safetyTemplates.messageFor(effective), effective, 0.0, ConfidenceLevel.LOW,
                Tier.SAFETY_FALLBACK.index(), List.of(), new ValidationSummary(verdict, issues), List.of(), false);
    }

    private static List<String> withExhaustion(List<String> issues) {
        List<String> all = new ArrayList<>(issues);
        all.add(EXHAUSTED);
        return all;
    }

    private Optional<Answer> lookupCache(Query query) {
        if (this.responseCache == null || !this.cachePolicy.isLookupAllowed(query.category())) {
            return Optional.empty();
        }
        try {
            return this.responseCache.get(ResponseCachePolicy.key(query.normalized(), query.category())).map(Answer::asCached);
        } catch (RuntimeException e) {
            log.warn("Response cache read failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void storeAsync(Query query, Answer answer) {
        if (this.responseCache == null || !this.cachePolicy.shouldStore(answer)) {
            return;
        }
        String key = ResponseCachePolicy.key(query.normalized(), query.category());
        Duration ttl = this.cachePolicy.ttlFor(query.category());
        ResponseCache cache = this.responseCache;
        try {
            CompletableFuture.runAsync(() -> cache.set(key, answer, ttl), this.tierExecutor)
                    .exceptionally(ex -> {
                        log.warn("Response cache write failed: {}", ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Response cache write skipped, executor overloaded");
        }
    }
}
