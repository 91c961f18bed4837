package com.jreinhal.edbot.constant;

import com.jreinhal.edbot.model.Category;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed clinical vocabularies shared by the scorer and the validator.
 */
public final class ClinicalLexicon {

    /**
     * Medical words recognised as terminology when they appear in a question or a source.
     */
    public static final Set<String> MEDICAL_TERMS = Set.of(
            "protocol", "guideline", "criteria", "dose", "dosage", "medication", "drug",
            "treatment", "therapy", "diagnosis", "assessment", "management", "procedure",
            "emergency", "cardiac", "cardiology", "respiratory", "neurological", "infection",
            "sepsis", "stroke", "trauma", "arrest", "anaphylaxis", "ketoacidosis", "diabetic",
            "myocardial", "infarction", "embolism", "thrombosis", "pneumonia", "hypotension",
            "hypertension", "tachycardia", "bradycardia", "fibrillation", "intubation",
            "resuscitation", "transfusion", "consent", "activation", "triage", "pain",
            "epinephrine", "heparin", "insulin", "morphine", "aspirin", "amiodarone",
            "adenosine", "atropine", "naloxone", "ketamine", "propofol", "vancomycin",
            "ceftriaxone", "alteplase", "tenecteplase", "nitroglycerin", "fentanyl",
            "lorazepam", "midazolam", "potassium", "magnesium", "bicarbonate", "glucose",
            "antibiotics", "fluids", "lactate", "troponin", "pediatric", "adult", "pager",
            "contact", "on-call", "cath", "lab", "ultrasound", "imaging", "laboratory"
    );

    /**
     * Category indicator keywords used for alignment scoring.
     */
    public static final Map<Category, List<String>> CATEGORY_INDICATORS = Map.of(
            Category.CONTACT, List.of("contact", "phone", "pager", "call", "on-call", "extension"),
            Category.FORM, List.of("form", "document", "consent", "template", "pdf"),
            Category.PROTOCOL, List.of("protocol", "procedure", "step", "workflow", "activation"),
            Category.CRITERIA, List.of("criteria", "rule", "score", "assessment", "indication"),
            Category.DOSAGE, List.of("dose", "dosage", "mg", "ml", "units", "administration"),
            Category.SUMMARY, List.of("overview", "summary", "management", "treatment", "approach")
    );

    public static final List<String> AUTHORITY_INDICATORS = List.of(
            "protocol", "guideline", "standard", "recommended", "evidence-based",
            "clinical trial", "peer-reviewed", "fda approved", "aha", "acls",
            "american heart association", "emergency medicine", "intensive care",
            "critical care", "hospital policy", "medical center", "clinical pathway"
    );

    public static final List<String> AUTHORITY_SOURCE_MARKERS = List.of(
            "protocol", "guideline", "acls", "aha", "clinical", "policy"
    );

    public static final List<String> RELIABLE_SOURCE_MARKERS = List.of(
            "clinical", "medical", "hospital", "acls", "aha"
    );

    public static final List<String> UNCERTAINTY_MARKERS = List.of(
            "may", "might", "possibly", "potentially", "likely", "probably",
            "consider", "suggest", "recommend", "usually", "typically", "generally",
            "in most cases", "often", "sometimes", "variable", "depends on"
    );

    /**
     * Conditions whose protocols must state timing or a contact.
     */
    public static final List<String> TIME_CRITICAL_CONDITIONS = List.of(
            "stemi", "stroke", "sepsis", "cardiac arrest", "trauma", "code blue", "massive transfusion"
    );

    /**
     * Protocol topics in detection order. The first trigger phrase found in a question names the topic;
     * an answer for that topic must mention at least two of its keywords.
     */
    public static final Map<String, ProtocolTopic> PROTOCOL_TOPICS = protocolTopics(
            new ProtocolTopic("sepsis", List.of("sepsis", "septic"),
                    List.of("sepsis", "septic", "lactate", "sirs", "shock", "infection", "antibiotics",
                            "fluid", "fluids", "resuscitation", "blood cultures")),
            new ProtocolTopic("stemi", List.of("stemi", "myocardial infarction", "heart attack"),
                    List.of("stemi", "myocardial", "cath", "pci", "door-to-balloon", "ekg", "ecg", "troponin")),
            new ProtocolTopic("stroke", List.of("stroke", "tpa", "nihss"),
                    List.of("stroke", "tpa", "alteplase", "tenecteplase", "nihss", "ct", "last known well",
                            "neuro", "neurology")),
            new ProtocolTopic("trauma", List.of("trauma"),
                    List.of("trauma", "activation", "level", "gcs", "fast", "blood", "massive transfusion")),
            new ProtocolTopic("cardiac arrest", List.of("cardiac arrest", "code blue", "cpr"),
                    List.of("cardiac arrest", "code blue", "cpr", "acls", "rosc", "epinephrine", "defibrillation"))
    );

    public static final List<String> HIGH_ALERT_MEDICATIONS = List.of(
            "insulin", "heparin", "warfarin", "enoxaparin", "potassium chloride", "morphine",
            "hydromorphone", "fentanyl", "methotrexate", "chemotherapy", "magnesium sulfate",
            "propofol", "vasopressin", "norepinephrine", "alteplase", "tenecteplase"
    );

    public static final List<String> OUTDATED_MARKERS = List.of(
            "under review", "deprecated", "obsolete", "superseded", "no longer in use"
    );

    private ClinicalLexicon() {
    }

    private static Map<String, ProtocolTopic> protocolTopics(ProtocolTopic... topics) {
        Map<String, ProtocolTopic> byName = new LinkedHashMap<>();
        for (ProtocolTopic topic : topics) {
            byName.put(topic.name(), topic);
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * @param triggers phrases that name the topic in a question
     * @param keywords phrases expected in an answer about the topic
     */
    public record ProtocolTopic(String name, List<String> triggers, List<String> keywords) {
    }
}
