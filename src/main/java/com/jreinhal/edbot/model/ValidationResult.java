package com.jreinhal.edbot.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of checking a candidate answer against the text it cites.
 *
 * @param hardIssues issues that make the candidate unusable
 * @param minorIssues issues that keep the candidate but mark it for review
 * @param unsupportedRatio fraction of checked statements not supported by the sources
 */
public record ValidationResult(
        Verdict verdict,
        List<String> hardIssues,
        List<String> minorIssues,
        boolean hallucinationDetected,
        boolean grounded,
        double unsupportedRatio,
        List<String> safetyFlags) {

    public ValidationResult {
        hardIssues = hardIssues == null ? List.of() : List.copyOf(hardIssues);
        minorIssues = minorIssues == null ? List.of() : List.copyOf(minorIssues);
        safetyFlags = safetyFlags == null ? List.of() : List.copyOf(safetyFlags);
    }

    /**
     * All issues, hard ones first.
     */
    public List<String> issues() {
        ArrayList<String> all = new ArrayList<>(hardIssues);
        all.addAll(minorIssues);
        return List.copyOf(all);
    }

    public ValidationSummary summary() {
        return new ValidationSummary(verdict, issues());
    }
}
