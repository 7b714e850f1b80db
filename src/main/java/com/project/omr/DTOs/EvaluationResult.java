package com.project.omr.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResult(
        ResultStatus status,
        Integer score,
        Integer total,
        Double percentage,
        List<Integer> correct,
        List<Integer> wrong,
        List<Integer> unmarked,
        @JsonProperty("total_questions") Integer totalQuestions,
        @JsonProperty("detected_answers") Map<Integer, String> detectedAnswers,
        @JsonProperty("fill_details") Map<Integer, Map<String, Double>> fillDetails,
        String error
) {

    public static EvaluationResult error(String message) {
        return new EvaluationResult(ResultStatus.ERROR, null, null, null, null, null, null,
                null, null, null, message);
    }

    /** Copies score fields onto a detection so callers get both in one result. */
    public EvaluationResult withDetection(DetectionResult detection) {
        return new EvaluationResult(status, score, total, percentage, correct, wrong, unmarked,
                detection.totalQuestions(), detection.detectedAnswers(), detection.fillDetails(), error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
