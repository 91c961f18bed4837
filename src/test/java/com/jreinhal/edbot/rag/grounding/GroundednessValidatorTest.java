package com.jreinhal.edbot.rag.grounding;

import com.jreinhal.edbot.config.ValidationProperties;
import com.jreinhal.edbot.model.CandidateAnswer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ConfidenceFactors;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.model.ValidationResult;
import com.jreinhal.edbot.model.Verdict;
import com.jreinhal.edbot.rag.thesaurus.ThesaurusFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GroundednessValidatorTest {

    private static final String EPI_NO_POPULATION = "Epinephrine 0.5 mg IM (1 mg/mL) into the anterolateral thigh for anaphylaxis. "
            + "Repeat every 5 minutes as needed per hospital protocol.";

    private GroundednessValidator validator;

    @BeforeEach
    void setUp() {
        validator = new GroundednessValidator(new ValidationProperties(), ThesaurusFixtures.bundled());
    }

    @Test
    void dosageWithoutPopulationIsRejected() {
        ValidationResult result = validator.validate(Category.DOSAGE, "epinephrine dose for anaphylaxis",
                candidate(EPI_NO_POPULATION, EPI_NO_POPULATION, 0.78));

        assertEquals(Verdict.INVALID, result.verdict());
        assertEquals(List.of(GroundednessValidator.DOSAGE_MISSING_POPULATION), result.hardIssues());
        assertTrue(result.grounded());
    }

    @Test
    void completeDosageAnswerIsValid() {
        String text = "Adults: epinephrine 0.5 mg IM into the anterolateral thigh for anaphylaxis. Repeat every 5 minutes as needed.";

        ValidationResult result = validator.validate(Category.DOSAGE, "epinephrine dose for anaphylaxis", candidate(text, text, 0.9));

        assertEquals(Verdict.VALID, result.verdict(), () -> "issues: " + result.issues());
        assertFalse(result.hallucinationDetected());
        assertEquals(0.0, result.unsupportedRatio());
    }

    @Test
    void dosageMissingRouteAndFrequencyNeedsReview() {
        String text = "Pediatric acetaminophen 15 mg/kg for fever.";

        ValidationResult result = validator.validate(Category.DOSAGE, "acetaminophen dose", candidate(text, text, 0.9));

        assertEquals(Verdict.NEEDS_REVIEW, result.verdict());
        assertTrue(result.minorIssues().contains(GroundednessValidator.DOSAGE_MISSING_ROUTE));
        assertTrue(result.minorIssues().contains(GroundednessValidator.DOSAGE_MISSING_FREQUENCY));
    }

    @Test
    void timeCriticalProtocolNeedsTimingOrContact() {
        String text = "Activate the cath lab team and give aspirin.";

        ValidationResult result = validator.validate(Category.PROTOCOL, "what is the stemi protocol", candidate(text, text, 0.9));

        assertEquals(Verdict.INVALID, result.verdict());
        assertTrue(result.hardIssues().contains(GroundednessValidator.PROTOCOL_MISSING_TIMING));
    }

    @Test
    void timeCriticalProtocolWithPagerPasses() {
        String text = "Call the STEMI pager at 917-555-0100 within 10 minutes of the EKG.";

        ValidationResult result = validator.validate(Category.PROTOCOL, "what is the stemi protocol", candidate(text, text, 0.9));

        assertFalse(result.hardIssues().contains(GroundednessValidator.PROTOCOL_MISSING_TIMING));
    }

    @Test
    void protocolAnswerForAnotherConditionIsRejected() {
        String stemi = "STEMI Activation: Call the STEMI pager at 917-555-0100 within 10 minutes of EKG. "
                + "Door-to-balloon goal is 90 minutes per hospital policy protocol.";

        ValidationResult result = validator.validate(Category.PROTOCOL, "stroke code protocol", candidate(stemi, stemi, 0.9));

        assertEquals(Verdict.INVALID, result.verdict());
        assertTrue(result.hardIssues().contains(GroundednessValidator.PROTOCOL_TOPIC_MISMATCH));
    }

    @Test
    void protocolAnswerOnTopicPassesTopicCheck() {
        String stroke = "Stroke alert: page neurology within 5 minutes. Obtain non-contrast CT and NIHSS; tPA window is 4.5 hours from last known well.";

        ValidationResult result = validator.validate(Category.PROTOCOL, "stroke code protocol", candidate(stroke, stroke, 0.9));

        assertFalse(result.hardIssues().contains(GroundednessValidator.PROTOCOL_TOPIC_MISMATCH));
    }

    @Test
    void requestedTopicFollowsQuestionTriggers() {
        assertEquals("stroke", GroundednessValidator.requestedTopic("Stroke code protocol").name());
        assertEquals("stemi", GroundednessValidator.requestedTopic("heart attack pathway").name());
        assertEquals("cardiac arrest", GroundednessValidator.requestedTopic("code blue steps").name());
        assertNull(GroundednessValidator.requestedTopic("chest pain protocol"));
        assertNull(GroundednessValidator.requestedTopic(null));
    }

    @Test
    void shortCriteriaAnswerIsIncomplete() {
        String text = "Ottawa: ankle pain plus tenderness.";

        ValidationResult result = validator.validate(Category.CRITERIA, "ottawa ankle rules", candidate(text, text, 0.9));

        assertEquals(Verdict.INVALID, result.verdict());
        assertTrue(result.hardIssues().contains(GroundednessValidator.CRITERIA_INCOMPLETE));
    }

    @Test
    void hedgingLanguageNeedsReview() {
        String text = "Ceftriaxone may be given for meningitis at 2 g IV.";

        ValidationResult result = validator.validate(Category.SUMMARY, "meningitis treatment", candidate(text, text, 0.9));

        assertEquals(Verdict.NEEDS_REVIEW, result.verdict());
        assertTrue(result.minorIssues().contains("hedging language: may"));
    }

    @Test
    void cannedDisclaimerIsFlagged() {
        String text = "Aspirin 325 mg PO once. Please consult your doctor before use.";

        ValidationResult result = validator.validate(Category.SUMMARY, "aspirin", candidate(text, text, 0.9));

        assertTrue(result.minorIssues().contains("canned disclaimer detected"));
    }

    @Test
    void unsupportedStatementsAboveRatioAreHallucination() {
        String answer = "Give heparin 5000 units IV bolus. Start warfarin 10 mg daily.";
        String source = "Heparin 5000 units IV bolus.";

        ValidationResult result = validator.validate(Category.SUMMARY, "anticoagulation", candidate(answer, source, 0.9));

        assertEquals(Verdict.INVALID, result.verdict());
        assertTrue(result.hallucinationDetected());
        assertFalse(result.grounded());
        assertEquals(0.5, result.unsupportedRatio(), 1e-9);
        assertTrue(result.safetyFlags().contains("high_alert_medication"));
    }

    @Test
    void answerWithoutSourcesIsRejected() {
        CandidateAnswer candidate = new CandidateAnswer("Aspirin 325 mg.", Tier.BEST_EFFORT, List.of(), 0.5,
                ConfidenceFactors.uniform(0.5), 0.4);

        ValidationResult result = validator.validate(Category.SUMMARY, "aspirin", candidate);

        assertEquals(Verdict.INVALID, result.verdict());
        assertTrue(result.hardIssues().contains(GroundednessValidator.NO_SOURCES));
        assertTrue(result.safetyFlags().contains("no_sources"));
        assertTrue(result.safetyFlags().contains("low_confidence"));
    }

    @Test
    void outdatedSourceIsFlagged() {
        String text = "Sepsis fluids 30 ml/kg. This guideline is superseded by the 2024 bundle.";

        ValidationResult result = validator.validate(Category.SUMMARY, "sepsis fluids", candidate(text, text, 0.9));

        assertTrue(result.safetyFlags().contains("potentially_outdated"));
    }

    @Test
    void statementsWithoutClinicalContentAreNotChecked() {
        List<String> statements = validator.extractStatements("Hello there everyone. Give aspirin 325 mg now.\n- short");

        assertEquals(List.of("Give aspirin 325 mg now."), statements);
    }

    private static CandidateAnswer candidate(String answer, String sourceText, double confidence) {
        KnowledgeRecord source = KnowledgeRecord.builder("src-1").text(sourceText).build();
        return new CandidateAnswer(answer, Tier.CURATED_KB, List.of(source), 0.8, ConfidenceFactors.uniform(confidence), confidence);
    }
}
