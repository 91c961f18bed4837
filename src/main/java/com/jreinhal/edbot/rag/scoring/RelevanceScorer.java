package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.constant.StopWords;
import com.jreinhal.edbot.model.DocumentRef;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.util.ClinicalText;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Lexical relevance of candidate text to an expanded question.
 */
@Component
public class RelevanceScorer {
    private static final double PER_OCCURRENCE = 0.1;
    private static final double PER_TERM_CAP = 0.4;
    private static final double LENGTH_PIVOT_WORDS = 200.0;

    private final MedicalThesaurus thesaurus;

    public RelevanceScorer(MedicalThesaurus thesaurus) {
        this.thesaurus = thesaurus;
    }

    /**
     * Saturating term-frequency score in [0,1], damped for long texts. Returns 0 unless at least one
     * term derived from the question itself (not a category context word) occurs in the text.
     */
    public double relevance(Query query, String text) {
        if (text == null || text.isBlank() || query.expandedTerms().isEmpty()) {
            return 0.0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> context = new HashSet<>(this.thesaurus.contextTermsFor(query.category()));
        double raw = 0.0;
        boolean questionTermMatched = false;
        for (String term : query.expandedTerms()) {
            if (term.length() < 2 || StopWords.GROUNDING.contains(term)) {
                continue;
            }
            int count = ClinicalText.countPhrase(lower, term);
            if (count == 0) {
                continue;
            }
            raw += Math.min(count * PER_OCCURRENCE, PER_TERM_CAP);
            if (!context.contains(term)) {
                questionTermMatched = true;
            }
        }
        if (!questionTermMatched) {
            return 0.0;
        }
        double lengthFactor = 1.0 / (1.0 + Math.log1p(ClinicalText.wordCount(text) / LENGTH_PIVOT_WORDS));
        return Math.min(1.0, raw * lengthFactor);
    }

    /**
     * Strength of a keyword-to-document match for direct lookup. An index keyword found verbatim in
     * the question scores 0.8 plus 0.05 per keyword word (max 0.95); partial keyword overlap scores
     * at most 0.6.
     */
    public double documentMatch(Query query, DocumentRef ref) {
        String keyword = ref.matchedKeyword() == null ? "" : ref.matchedKeyword().toLowerCase(Locale.ROOT).trim();
        if (keyword.isEmpty()) {
            return 0.0;
        }
        List<String> keywordTokens = ClinicalText.tokens(keyword);
        if (ClinicalText.containsPhrase(query.normalized(), keyword)) {
            return Math.min(0.95, 0.8 + 0.05 * keywordTokens.size());
        }
        if (keywordTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> queryTokens = new HashSet<>(ClinicalText.tokens(query.normalized()));
        queryTokens.addAll(query.expandedTerms());
        long present = keywordTokens.stream().filter(queryTokens::contains).count();
        return 0.6 * present / keywordTokens.size();
    }
}
