package com.project.omr.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResult(
        ResultStatus status,
        @JsonProperty("total_questions") Integer totalQuestions,
        @JsonProperty("detected_answers") Map<Integer, String> detectedAnswers,
        @JsonProperty("fill_details") Map<Integer, Map<String, Double>> fillDetails, // only with debug
        String error
) {

    public static DetectionResult success(Map<Integer, String> answers, Map<Integer, Map<String, Double>> fillDetails) {
        return new DetectionResult(ResultStatus.SUCCESS, answers.size(),
                Collections.unmodifiableMap(answers),
                fillDetails == null ? null : Collections.unmodifiableMap(fillDetails),
                null);
    }

    public static DetectionResult error(String message) {
        return new DetectionResult(ResultStatus.ERROR, null, null, null, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
