package com.jreinhal.edbot.rag.scoring;

import com.jreinhal.edbot.constant.ClinicalLexicon;
import com.jreinhal.edbot.constant.StopWords;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ConfidenceFactors;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Query;
import com.jreinhal.edbot.model.TrustTier;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.util.ClinicalText;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Computes the seven confidence factors of a record against a question and combines them
 * with category-specific weights.
 */
@Component
public class ConfidenceCalculator {
    private static final Pattern NUMERIC_UNIT = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*(?:mg/kg|mcg/kg|mg|mcg|g|ml|units?|minutes?|min|hours?|hrs?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROCEDURAL = Pattern.compile("\\b(?:protocol|procedure|step\\s*\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTACT = Pattern.compile("\\b(?:contact|phone|pager)\\b|\\b\\d{3}-\\d{3}-\\d{4}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CRITERIA = Pattern.compile("\\b(?:criteria|indications?|contraindications?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEDGE = Pattern.compile("\\b(?:may|might|consider|possibly|usually)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ABBREVIATION = Pattern.compile("\\b[A-Z][A-Z0-9]{1,6}\\b");

    private final MedicalThesaurus thesaurus;

    public ConfidenceCalculator(MedicalThesaurus thesaurus) {
        this.thesaurus = thesaurus;
    }

    public ConfidenceAssessment assess(Query query, KnowledgeRecord record) {
        ConfidenceFactors factors = this.factors(query, record);
        double confidence = ConfidenceWeights.forCategory(query.category()).combine(factors);
        return new ConfidenceAssessment(factors, confidence);
    }

    public ConfidenceFactors factors(Query query, KnowledgeRecord record) {
        String text = record.text();
        String lower = text.toLowerCase(Locale.ROOT);
        return new ConfidenceFactors(
                sourceReliability(query.category(), record),
                contentSpecificity(text),
                this.terminologyMatch(query, text, lower),
                categoryAlignment(query.category(), record, lower),
                this.informationCompleteness(query, lower),
                authorityIndicators(record, lower),
                uncertaintyMarkers(lower));
    }

    static double sourceReliability(Category queryCategory, KnowledgeRecord record) {
        String contentType = record.contentType().toLowerCase(Locale.ROOT);
        String name = (record.displayName() + " " + record.documentId()).toLowerCase(Locale.ROOT);
        double score;
        if (record.trustTier() == TrustTier.CURATED_QA) {
            score = record.trustTier().baseReliability();
        } else if (contentType.equals("protocol") || contentType.equals("guideline") || contentType.equals("criteria")) {
            score = 0.95;
        } else if (contentType.equals("medication") || contentType.equals("dosage")) {
            score = 0.9;
        } else if (contentType.equals("form") || contentType.equals("document")) {
            score = 0.8;
        } else if (name.contains("protocol") || name.contains("guideline")) {
            score = 0.85;
        } else if (record.category() != null && record.category() == queryCategory) {
            score = 0.8;
        } else {
            score = record.trustTier().baseReliability();
        }
        for (String marker : ClinicalLexicon.RELIABLE_SOURCE_MARKERS) {
            if (name.contains(marker)) {
                score += 0.1;
                break;
            }
        }
        return Math.min(1.0, score);
    }

    static double contentSpecificity(String text) {
        double score = 0.5;
        if (NUMERIC_UNIT.matcher(text).find()) {
            score += 0.2;
        }
        if (PROCEDURAL.matcher(text).find()) {
            score += 0.2;
        }
        if (CONTACT.matcher(text).find()) {
            score += 0.15;
        }
        if (CRITERIA.matcher(text).find()) {
            score += 0.15;
        }
        if (HEDGE.matcher(text).find()) {
            score -= 0.1;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    double terminologyMatch(Query query, String text, String lowerText) {
        Set<String> queryTerms = this.medicalTerms(query.raw());
        if (queryTerms.isEmpty()) {
            return 0.5;
        }
        if (this.medicalTerms(text).isEmpty()) {
            return 0.3;
        }
        int matched = 0;
        for (String term : queryTerms) {
            if (this.coveredBy(lowerText, term)) {
                matched++;
            }
        }
        return (double) matched / queryTerms.size();
    }

    /**
     * Abbreviations written in capitals, lexicon words and dictionary terms found in the text, lowercased.
     */
    Set<String> medicalTerms(String text) {
        LinkedHashSet<String> terms = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return terms;
        }
        Matcher m = ABBREVIATION.matcher(text);
        while (m.find()) {
            String token = m.group().toLowerCase(Locale.ROOT);
            if (this.thesaurus.isAbbreviation(token)) {
                terms.add(token);
            }
        }
        for (String token : ClinicalText.tokens(text)) {
            if (ClinicalLexicon.MEDICAL_TERMS.contains(token)) {
                terms.add(token);
            }
        }
        for (String known : this.thesaurus.knownTermsIn(text)) {
            if (!StopWords.GROUNDING.contains(known)) {
                terms.add(known);
            }
        }
        return terms;
    }

    static double categoryAlignment(Category category, KnowledgeRecord record, String lowerText) {
        List<String> indicators = ClinicalLexicon.CATEGORY_INDICATORS.getOrDefault(category, List.of());
        if (indicators.isEmpty()) {
            return 0.5;
        }
        int matches = 0;
        for (String indicator : indicators) {
            if (ClinicalText.containsPhrase(lowerText, indicator)) {
                matches++;
            }
        }
        double score = (double) matches / indicators.size();
        if (record.category() != null && record.category() == category) {
            score += 0.2;
        }
        return Math.min(1.0, score);
    }

    double informationCompleteness(Query query, String lowerText) {
        Set<String> concepts = queryConcepts(query);
        if (concepts.isEmpty()) {
            return 0.7;
        }
        int covered = 0;
        for (String concept : concepts) {
            if (this.coveredBy(lowerText, concept)) {
                covered++;
            }
        }
        double score = (double) covered / concepts.size();
        score += Math.min(0.2, lowerText.length() / 1000.0);
        return Math.min(1.0, score);
    }

    static Set<String> queryConcepts(Query query) {
        LinkedHashSet<String> concepts = new LinkedHashSet<>();
        for (String token : ClinicalText.tokens(query.normalized())) {
            if (token.length() >= 4 && !StopWords.CONCEPT_NOISE.contains(token) && !StopWords.QUERY_KEYWORDS.contains(token)) {
                concepts.add(token);
            }
        }
        return concepts;
    }

    static double authorityIndicators(KnowledgeRecord record, String lowerText) {
        int count = 0;
        for (String indicator : ClinicalLexicon.AUTHORITY_INDICATORS) {
            if (ClinicalText.containsPhrase(lowerText, indicator)) {
                count++;
            }
        }
        double score = 0.4 + Math.min(0.4, count * 0.1);
        String name = (record.displayName() + " " + record.documentId()).toLowerCase(Locale.ROOT);
        for (String marker : ClinicalLexicon.AUTHORITY_SOURCE_MARKERS) {
            if (name.contains(marker)) {
                score += 0.2;
                break;
            }
        }
        return Math.min(1.0, score);
    }

    static double uncertaintyMarkers(String lowerText) {
        if (lowerText.isEmpty()) {
            return 1.0;
        }
        int count = 0;
        for (String marker : ClinicalLexicon.UNCERTAINTY_MARKERS) {
            count += ClinicalText.countPhrase(lowerText, marker);
        }
        double density = count / Math.max(1.0, lowerText.length() / 100.0);
        return Math.max(0.0, 1.0 - density * 0.2);
    }

    private boolean coveredBy(String lowerText, String term) {
        if (ClinicalText.containsPhrase(lowerText, term)) {
            return true;
        }
        for (String related : this.thesaurus.relatedTerms(term)) {
            if (ClinicalText.containsPhrase(lowerText, related)) {
                return true;
            }
        }
        return false;
    }
}
