package com.project.omr.DTOs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record QuestionResult(int questionNumber, MarkStatus status, String option, Map<String, Double> fillRatios) {

    public QuestionResult {
        if ((status == MarkStatus.MARKED) != (option != null)) {
            throw new IllegalArgumentException("Option must be set exactly when the question is marked");
        }
        fillRatios = Collections.unmodifiableMap(new LinkedHashMap<>(fillRatios));
    }

    /** Letter for a marked question, otherwise "unmarked" / "ambiguous". */
    public String answer() {
        return status == MarkStatus.MARKED ? option : status.label();
    }
}
