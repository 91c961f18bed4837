package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ConfidenceFactors;
import com.jreinhal.edbot.model.DocumentRef;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.model.TrustTier;
import com.jreinhal.edbot.rag.scoring.ConfidenceCalculator;
import com.jreinhal.edbot.rag.scoring.RelevanceScorer;
import com.jreinhal.edbot.store.FormIndex;
import com.jreinhal.edbot.util.LogSanitizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Tier 0: resolves form requests straight to a document through the keyword index.
 *
 * <p>Only FORM questions are eligible. The candidate's confidence is the keyword-match strength of
 * the best document; the seven factors are still computed for transparency.</p>
 */
@Component
public class DirectLookupTier implements RetrievalTier {
    private static final Logger log = LoggerFactory.getLogger(DirectLookupTier.class);

    @Nullable
    private final FormIndex formIndex;
    private final RelevanceScorer relevanceScorer;
    private final ConfidenceCalculator confidenceCalculator;

    public DirectLookupTier(@Nullable FormIndex formIndex, RelevanceScorer relevanceScorer,
                            ConfidenceCalculator confidenceCalculator) {
        this.formIndex = formIndex;
        this.relevanceScorer = relevanceScorer;
        this.confidenceCalculator = confidenceCalculator;
    }

    @Override
    public Tier tier() {
        return Tier.DIRECT_LOOKUP;
    }

    @Override
    public TierResult retrieve(Query query, RetrievalContext context) {
        if (query.category() != Category.FORM) {
            return TierResult.empty(Tier.DIRECT_LOOKUP, "not a form request");
        }
        if (this.formIndex == null) {
            return TierResult.failure(Tier.DIRECT_LOOKUP, TierError.Kind.STORE_UNAVAILABLE, "no form index configured");
        }
        List<DocumentRef> refs;
        try {
            refs = this.formIndex.resolve(keywords(query));
        } catch (RuntimeException e) {
            log.warn("Form index lookup failed: {}", e.getMessage());
            return TierResult.failure(Tier.DIRECT_LOOKUP, TierError.Kind.STORE_FAILURE, "form index failed: " + e.getClass().getSimpleName());
        }
        if (refs == null || refs.isEmpty()) {
            return TierResult.empty(Tier.DIRECT_LOOKUP, "no form matched");
        }

        DocumentRef best = null;
        double bestScore = 0.0;
        for (DocumentRef ref : refs) {
            double score = this.relevanceScorer.documentMatch(query, ref);
            if (score > bestScore) {
                best = ref;
                bestScore = score;
            }
        }
        if (best == null) {
            return TierResult.empty(Tier.DIRECT_LOOKUP, "no form matched");
        }

        KnowledgeRecord record = formRecord(best, bestScore);
        ConfidenceFactors factors = this.confidenceCalculator.factors(query, record);
        if (log.isDebugEnabled()) {
            log.debug("Direct lookup matched '{}' via keyword '{}' ({})", LogSanitizer.sanitize(best.documentId()),
                    LogSanitizer.sanitize(best.matchedKeyword()),
                    LogSanitizer.score(bestScore, 2));
        }
        return TierResult.candidate(new CandidateAnswer(record.text(), Tier.DIRECT_LOOKUP, List.of(record), bestScore, factors, bestScore));
    }

    /**
     * The whole normalized question plus every expanded term; the index matches its keywords as phrases.
     */
    static List<String> keywords(Query query) {
        Set<String> keywords = new LinkedHashSet<>();
        keywords.add(query.normalized());
        keywords.addAll(query.expandedTerms());
        return new ArrayList<>(keywords);
    }

    /**
     * The record text is generated from the index entry, so answers built on it carry no evidence spans.
     */
    static KnowledgeRecord formRecord(DocumentRef ref, double score) {
        String text = "Requested form: " + ref.displayName() + " (" + ref.documentId() + ")";
        return KnowledgeRecord.builder(ref.documentId())
                .documentId(ref.documentId())
                .displayName(ref.displayName())
                .text(text)
                .trustTier(TrustTier.STRUCTURED_PROTOCOL)
                .category(Category.FORM)
                .storeScore(score)
                .metadata("content_type", "form")
                .metadata("matched_keyword", ref.matchedKeyword())
                .build();
    }
}
