package com.jreinhal.edbot.rag.grounding;

import com.jreinhal.edbot.config.ValidationProperties;
import com.jreinhal.edbot.constant.ClinicalLexicon;
import com.jreinhal.edbot.constant.StopWords;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.ValidationResult;
import com.jreinhal.edbot.model.Verdict;
import com.jreinhal.edbot.rag.thesaurus.MedicalThesaurus;
import com.jreinhal.edbot.util.ClinicalText;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groundedness Validator.
 *
 * Checks a candidate answer against the raw text of the records it cites:
 * - every factual statement must share most of its significant terms with the sources
 * - hedging language and canned disclaimers are flagged for review
 * - category rules catch structurally incomplete protocol, dosage and criteria answers
 * - a protocol answer must be about the protocol the question names
 *
 * This is structural validation only. It does not check clinical correctness.
 */
@Component
public class GroundednessValidator {

    private static final Logger log = LoggerFactory.getLogger(GroundednessValidator.class);

    static final String PROTOCOL_MISSING_TIMING = "protocol missing timing or contact for time-critical condition";
    static final String PROTOCOL_TOPIC_MISMATCH = "protocol answer does not address the requested protocol";
    static final String DOSAGE_MISSING_DOSE = "dosage missing unit-qualified dose";
    static final String DOSAGE_MISSING_POPULATION = "dosage missing population qualifier";
    static final String DOSAGE_MISSING_ROUTE = "dosage missing route";
    static final String DOSAGE_MISSING_FREQUENCY = "dosage missing frequency";
    static final String CRITERIA_INCOMPLETE = "criteria answer incomplete";
    static final String NO_SOURCES = "answer has no cited source";

    private static final Pattern STATEMENT_SPLIT = Pattern.compile("(?<=[.!?])\\s+|\\n+");
    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*\\u2022]+|\\d+[.)])\\s*");
    private static final Pattern HAS_NUMBER = Pattern.compile("\\d");
    private static final Pattern ABBREVIATION = Pattern.compile("\\b[A-Z]{2,}\\b");

    private static final Pattern HEDGE = Pattern.compile(
            "\\b(may|might|probably|possibly|perhaps|i think|i believe|it seems|not sure|unclear)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISCLAIMER = Pattern.compile(
            "consult (?:your|a) (?:doctor|physician|healthcare provider)"
                    + "|seek (?:immediate )?medical (?:attention|advice|care)"
                    + "|this (?:is not|does not constitute) medical advice"
                    + "|as an ai", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIMING = Pattern.compile(
            "\\b\\d+\\s*(?:-\\s*\\d+\\s*)?(?:minutes?|mins?|hours?|hrs?|seconds?|secs?)\\b|<\\s*\\d+|\\bwithin\\s+\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTACT_ID = Pattern.compile(
            "\\(?\\b\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b|\\bpager\\s*[:#]?\\s*\\d+|\\bx\\d{4,5}\\b|\\bext\\.?\\s*\\d{3,5}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOSE = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*(?:mg/kg|mcg/kg|units/kg|mg|mcg|g|ml|units?|iu|meq)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern POPULATION = Pattern.compile(
            "\\b(?:adults?|pediatrics?|paediatric|child(?:ren)?|infants?|neonat\\w*|geriatric|elderly|weight[- ]based|per kg)\\b"
                    + "|/kg\\b|\\b\\d+\\s*kg\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUTE = Pattern.compile(
            "\\b(?:IV|IM|PO|SQ|SC|IO|IN|PR|SL)\\b"
                    + "|(?i:\\b(?:intravenous(?:ly)?|intramuscular(?:ly)?|oral(?:ly)?|subcutaneous(?:ly)?|intraosseous|intranasal|nebuli[sz]ed|inhaled|sublingual)\\b)");
    private static final Pattern FREQUENCY = Pattern.compile(
            "\\b(?:every|q\\d+h?|qd|bid|tid|qid|daily|once|twice|repeat|repeated|per hour|continuous|infusion|prn|as needed)\\b|/hr\\b|/min\\b",
            Pattern.CASE_INSENSITIVE);

    private final ValidationProperties props;
    private final MedicalThesaurus thesaurus;

    public GroundednessValidator(ValidationProperties props, MedicalThesaurus thesaurus) {
        this.props = props;
        this.thesaurus = thesaurus;
    }

    /**
     * Validate a candidate answer against its cited records.
     *
     * @param category category of the question the answer responds to
     * @param question normalized question text, used for condition and medication detection
     * @param candidate answer under validation
     * @return validation verdict with issues and safety flags
     */
    public ValidationResult validate(Category category, String question, CandidateAnswer candidate) {
        String answer = candidate.text() == null ? "" : candidate.text();
        List<String> hard = new ArrayList<>();
        List<String> minor = new ArrayList<>();

        String sourceText = concatenateSources(candidate.sources());
        if (sourceText.isBlank()) {
            hard.add(NO_SOURCES);
        }

        Set<String> sourceTokens = new HashSet<>(ClinicalText.tokens(sourceText));
        List<String> statements = this.extractStatements(answer);
        int unsupported = 0;
        for (String statement : statements) {
            if (!this.isSupported(statement, sourceTokens)) {
                unsupported++;
                minor.add("unsupported fact: " + ClinicalText.truncate(statement, 80));
            }
        }
        double unsupportedRatio = statements.isEmpty() ? 0.0 : (double) unsupported / statements.size();
        boolean hallucination = unsupportedRatio > this.props.getMaxUnsupportedRatio();
        if (hallucination) {
            hard.add(String.format(Locale.ROOT, "unsupported fact ratio %.2f exceeds %.2f",
                    unsupportedRatio, this.props.getMaxUnsupportedRatio()));
        }

        Matcher hedge = HEDGE.matcher(answer);
        if (hedge.find()) {
            minor.add("hedging language: " + hedge.group(1).toLowerCase(Locale.ROOT));
        }
        if (DISCLAIMER.matcher(answer).find()) {
            minor.add("canned disclaimer detected");
        }

        this.applyCategoryRules(category, question, answer, hard, minor);

        Verdict verdict;
        if (!hard.isEmpty()) {
            verdict = Verdict.INVALID;
        } else if (!minor.isEmpty()) {
            verdict = Verdict.NEEDS_REVIEW;
        } else {
            verdict = Verdict.VALID;
        }
        boolean grounded = unsupported == 0 && !sourceText.isBlank();
        List<String> flags = safetyFlags(question, answer, sourceText, candidate);

        if (log.isDebugEnabled()) {
            log.debug("Validation of tier {} candidate: verdict={}, statements={}, unsupported={}, hard={}, minor={}",
                    candidate.tier(), verdict, statements.size(), unsupported, hard.size(), minor.size());
        }
        return new ValidationResult(verdict, hard, minor, hallucination, grounded, unsupportedRatio, flags);
    }

    /**
     * Sentence-level statements that carry a medical or quantitative keyword.
     */
    List<String> extractStatements(String answer) {
        List<String> statements = new ArrayList<>();
        for (String part : STATEMENT_SPLIT.split(answer)) {
            String s = LIST_MARKER.matcher(part).replaceFirst("").trim();
            if (s.length() < 10) {
                continue;
            }
            if (this.hasClinicalKeyword(s)) {
                statements.add(s);
            }
        }
        return statements;
    }

    private boolean hasClinicalKeyword(String statement) {
        if (HAS_NUMBER.matcher(statement).find() || ABBREVIATION.matcher(statement).find()) {
            return true;
        }
        for (String token : ClinicalText.tokens(statement)) {
            if (ClinicalLexicon.MEDICAL_TERMS.contains(token)) {
                return true;
            }
        }
        return !this.thesaurus.knownTermsIn(statement).isEmpty();
    }

    private boolean isSupported(String statement, Set<String> sourceTokens) {
        Set<String> terms = ClinicalText.significantTokens(statement, StopWords.GROUNDING, 3);
        if (terms.isEmpty()) {
            return true;
        }
        long present = terms.stream().filter(sourceTokens::contains).count();
        return (double) present / terms.size() >= this.props.getSupportThreshold();
    }

    static ClinicalLexicon.ProtocolTopic requestedTopic(String question) {
        if (question == null || question.isBlank()) {
            return null;
        }
        String lower = question.toLowerCase(Locale.ROOT);
        for (ClinicalLexicon.ProtocolTopic topic : ClinicalLexicon.PROTOCOL_TOPICS.values()) {
            if (topic.triggers().stream().anyMatch(t -> ClinicalText.containsPhrase(lower, t))) {
                return topic;
            }
        }
        return null;
    }

    private static long keywordMatches(ClinicalLexicon.ProtocolTopic topic, String lowerAnswer) {
        return topic.keywords().stream().filter(k -> ClinicalText.containsPhrase(lowerAnswer, k)).count();
    }

    private void applyCategoryRules(Category category, String question, String answer, List<String> hard, List<String> minor) {
        if (category == null) {
            return;
        }
        switch (category) {
            case PROTOCOL -> {
                String haystack = ((question == null ? "" : question) + " " + answer).toLowerCase(Locale.ROOT);
                boolean timeCritical = ClinicalLexicon.TIME_CRITICAL_CONDITIONS.stream()
                        .anyMatch(c -> ClinicalText.containsPhrase(haystack, c));
                if (timeCritical && !TIMING.matcher(answer).find() && !CONTACT_ID.matcher(answer).find()) {
                    hard.add(PROTOCOL_MISSING_TIMING);
                }
                ClinicalLexicon.ProtocolTopic topic = requestedTopic(question);
                if (topic != null && keywordMatches(topic, answer.toLowerCase(Locale.ROOT)) < 2) {
                    hard.add(PROTOCOL_TOPIC_MISMATCH);
                    if (log.isDebugEnabled()) {
                        log.debug("Protocol candidate does not mention the {} protocol", topic.name());
                    }
                }
            }
            case DOSAGE -> {
                boolean hasDose = DOSE.matcher(answer).find();
                if (!hasDose) {
                    hard.add(DOSAGE_MISSING_DOSE);
                }
                if (!POPULATION.matcher(answer).find()) {
                    hard.add(DOSAGE_MISSING_POPULATION);
                }
                if (hasDose && !ROUTE.matcher(answer).find()) {
                    minor.add(DOSAGE_MISSING_ROUTE);
                }
                if (hasDose && !FREQUENCY.matcher(answer).find()) {
                    minor.add(DOSAGE_MISSING_FREQUENCY);
                }
            }
            case CRITERIA -> {
                if (answer.trim().length() < this.props.getMinCriteriaLength()) {
                    hard.add(CRITERIA_INCOMPLETE);
                }
            }
            default -> {
            }
        }
    }

    private static List<String> safetyFlags(String question, String answer, String sourceText, CandidateAnswer candidate) {
        LinkedHashSet<String> flags = new LinkedHashSet<>();
        if (candidate.confidence() < 0.5) {
            flags.add("low_confidence");
        }
        if (candidate.sources().isEmpty()) {
            flags.add("no_sources");
        }
        String lowerSource = sourceText.toLowerCase(Locale.ROOT);
        for (String marker : ClinicalLexicon.OUTDATED_MARKERS) {
            if (lowerSource.contains(marker)) {
                flags.add("potentially_outdated");
                break;
            }
        }
        Set<String> doses = new HashSet<>();
        Matcher dose = DOSE.matcher(answer);
        while (dose.find()) {
            doses.add(dose.group().toLowerCase(Locale.ROOT).replaceAll("\\s+", ""));
        }
        if (doses.size() > 3) {
            flags.add("multiple_dosage_recommendations");
        }
        String lowerAll = ((question == null ? "" : question) + " " + answer).toLowerCase(Locale.ROOT);
        for (String medication : ClinicalLexicon.HIGH_ALERT_MEDICATIONS) {
            if (ClinicalText.containsPhrase(lowerAll, medication)) {
                flags.add("high_alert_medication");
                break;
            }
        }
        return new ArrayList<>(flags);
    }

    private static String concatenateSources(List<KnowledgeRecord> sources) {
        StringBuilder sb = new StringBuilder();
        for (KnowledgeRecord record : sources) {
            if (record != null && !record.text().isBlank()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(record.text());
            }
        }
        return sb.toString();
    }
}
