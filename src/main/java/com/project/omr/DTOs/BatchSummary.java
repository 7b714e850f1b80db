package com.project.omr.DTOs;

import java.util.List;

public record BatchSummary(
        List<SheetOutcome> sheets,     // input order
        int succeeded,
        int failed,
        double averagePercentage       // over successful sheets, 0.0 when none
) {
    public record SheetOutcome(String file, EvaluationResult result) {}
}
