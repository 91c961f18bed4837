package com.jreinhal.edbot.rag.classifier;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.util.ClinicalText;
import com.jreinhal.edbot.util.LogSanitizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rule-based intent classification of clinical questions.
 *
 * <p>Each category owns a set of weighted indicator patterns; a category's score is the sum of the
 * weights of its patterns that match, capped at 1.0. Categories are then checked in the fixed order
 * of {@link Category#PRIORITY} and the first one scoring above {@link #EPSILON} wins, so a question
 * that mentions both a form and a protocol is a form request. With no signal at all the question is
 * treated as a low-confidence summary request.</p>
 */
@Component
public class QueryClassifier {
    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    static final double EPSILON = 0.05;
    static final double NO_SIGNAL_CONFIDENCE = 0.2;
    private static final double PATTERN_WEIGHT = 0.4;
    private static final double KEYWORD_WEIGHT = 0.2;
    private static final double SHORT_QUERY_BOOST = 0.3;
    private static final int SHORT_QUERY_WORDS = 10;

    private static final Map<Category, List<Indicator>> INDICATORS = buildIndicators();

    public ClassificationResult classify(String text) {
        String normalized = ClinicalText.normalizeQuery(text);
        EnumMap<Category, Double> scores = new EnumMap<>(Category.class);
        EnumMap<Category, List<String>> evidence = new EnumMap<>(Category.class);
        for (Category category : Category.PRIORITY) {
            double score = 0.0;
            List<String> fired = new ArrayList<>();
            if (!normalized.isEmpty()) {
                for (Indicator indicator : INDICATORS.getOrDefault(category, List.of())) {
                    if (indicator.pattern().matcher(normalized).find()) {
                        score += indicator.weight();
                        fired.add(indicator.label());
                    }
                }
            }
            scores.put(category, Math.min(1.0, score));
            evidence.put(category, fired);
        }

        for (Category category : Category.PRIORITY) {
            double score = scores.get(category);
            if (score > EPSILON) {
                double confidence = score;
                if (score > 0.5 && ClinicalText.wordCount(normalized) < SHORT_QUERY_WORDS) {
                    confidence = Math.min(1.0, score + SHORT_QUERY_BOOST);
                }
                if (log.isDebugEnabled()) {
                    log.debug("Classified query {} as {} (confidence={}, evidence={})",
                            LogSanitizer.querySummary(text), category, confidence, evidence.get(category));
                }
                return new ClassificationResult(category, confidence, evidence.get(category), scores);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("No category signal for query {}; defaulting to SUMMARY", LogSanitizer.querySummary(text));
        }
        return new ClassificationResult(Category.SUMMARY, NO_SIGNAL_CONFIDENCE, List.of("no-signal"), scores);
    }

    private static Map<Category, List<Indicator>> buildIndicators() {
        EnumMap<Category, List<Indicator>> map = new EnumMap<>(Category.class);
        map.put(Category.CONTACT, List.of(
                pattern("\\b(who is on call|on[- ]call|contact|phone|pager)\\b"),
                pattern("\\b(attending|fellow|resident)\\b.*\\b(today|tonight|now)\\b"),
                pattern("\\b(call|reach|contact)\\b.*\\b(cardiology|surgery|medicine|neurology)\\b"),
                pattern("\\b(directory|phone number|pager number|extension)\\b")));
        map.put(Category.FORM, List.of(
                pattern("\\b(show me|find|get|need)\\b.*\\bforms?\\b"),
                pattern("\\b(consent|checklist|template|document)\\b"),
                pattern("\\b(pdf|download|print)\\b.*\\b(form|consent)\\b"),
                pattern("\\b(where is|where can i find)\\b.*\\b(form|consent)\\b"),
                pattern("\\b(ama|autopsy|transfer|pca)\\s+(form|departure)\\b"),
                pattern("\\b(blood transfusion|pathology|clinical debriefing)\\b.*\\b(form|consent)\\b"),
                pattern("\\b(bed request|radiology request|downtime)\\b.*\\bform\\b"),
                keyword("form"), keyword("request")));
        map.put(Category.PROTOCOL, List.of(
                pattern("\\b(protocol|procedure|how to|steps|algorithm)\\b"),
                pattern("\\bwhat is the\\b.*\\bprotocol\\b|\\bprotocol for\\b"),
                pattern("\\b(manage|management|treatment|workflow|pathway)\\b"),
                pattern("\\b(stemi|stroke|trauma|sepsis|cardiac arrest)\\b.*\\b(protocol|management|activation)\\b"),
                keyword("stemi"), keyword("stroke code"), keyword("sepsis"), keyword("workflow")));
        map.put(Category.DOSAGE, List.of(
                pattern("\\b(dose|doses|dosage|dosing|how much)\\b"),
                pattern("\\b\\d*\\s*(mg|ml|units|mcg|g)\\b.*\\b(give|administer|dose)\\b"),
                pattern("\\b(medication|drug|medicine)\\b.*\\b(dose|amount)\\b"),
                pattern("\\b(epinephrine|heparin|morphine|insulin|antibiotics?)\\b.*\\b(dose|dosing|dosage)\\b"),
                keyword("mg/kg"), keyword("mcg")));
        map.put(Category.CRITERIA, List.of(
                pattern("\\b(criteria|when to|should i|indications?)\\b"),
                pattern("\\bwhat are the criteria\\b|\\bcriteria for\\b"),
                pattern("\\b(activate|call|consult|transfer)\\b.*\\b(when|criteria)\\b"),
                pattern("\\b(threshold|cutoff|limit|range)\\b"),
                pattern("\\b(contraindications?|exclusion|eligibility)\\b"),
                pattern("\\b(ottawa|wells|centor|nexus|perc|pecarn)\\b.*\\b(rules?|score|criteria)\\b"
                        + "|\\b(rules?|score|criteria)\\b.*\\b(ottawa|wells|centor|nexus|perc|pecarn)\\b"),
                keyword("ottawa"), keyword("wells"), keyword("perc"), keyword("nexus"), keyword("centor"),
                keyword("guideline"), keyword("rules")));
        map.put(Category.SUMMARY, List.of(
                pattern("\\b(tell me about|overview|summary|general|information)\\b"),
                pattern("\\b(what is|explain|describe)\\b(?!.*\\b(protocol|dose|dosage|form|criteria|contact)\\b)"),
                pattern("\\b(workup|evaluation|assessment|diagnosis)\\b"),
                pattern("\\b(guidelines|recommendations|approach)\\b")));
        return map;
    }

    private static Indicator pattern(String regex) {
        return new Indicator("/" + regex + "/", Pattern.compile(regex, Pattern.CASE_INSENSITIVE), PATTERN_WEIGHT);
    }

    private static Indicator keyword(String word) {
        return new Indicator("keyword:" + word, Pattern.compile("(?<![\\w])" + Pattern.quote(word) + "(?![\\w])", Pattern.CASE_INSENSITIVE), KEYWORD_WEIGHT);
    }

    private record Indicator(String label, Pattern pattern, double weight) {
    }
}
