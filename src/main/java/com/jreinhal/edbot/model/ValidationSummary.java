package com.jreinhal.edbot.model;

import java.util.List;

public record ValidationSummary(Verdict verdict, List<String> issues) {

    public ValidationSummary {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
