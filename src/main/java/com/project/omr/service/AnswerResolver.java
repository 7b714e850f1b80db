package com.project.omr.service;

import com.project.omr.DTOs.BinaryMask;
import com.project.omr.DTOs.DetectionResult;
import com.project.omr.DTOs.QuestionResult;
import com.project.omr.DTOs.Row;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
public class AnswerResolver {

    private final FillClassifier fillClassifier;

    public AnswerResolver(FillClassifier fillClassifier) {
        this.fillClassifier = fillClassifier;
    }

    public DetectionResult resolve(List<Row> rows, BinaryMask mask, double fillThreshold, boolean debug) {
        return resolve(classifyAll(rows, mask, fillThreshold), debug);
    }

    public List<QuestionResult> classifyAll(List<Row> rows, BinaryMask mask, double fillThreshold) {
        List<QuestionResult> results = new ArrayList<>(rows.size());
        for (Row row : rows) {
            results.add(fillClassifier.classify(row, mask, fillThreshold));
        }
        return results;
    }

    public DetectionResult resolve(List<QuestionResult> results, boolean debug) {
        Map<Integer, String> answers = new TreeMap<>();
        Map<Integer, Map<String, Double>> fillDetails = debug ? new TreeMap<>() : null;

        for (QuestionResult result : results) {
            answers.put(result.questionNumber(), result.answer());
            if (fillDetails != null) {
                Map<String, Double> rounded = new LinkedHashMap<>();
                result.fillRatios().forEach((letter, ratio) -> rounded.put(letter, Evaluator.round2(ratio)));
                fillDetails.put(result.questionNumber(), rounded);
            }
        }
        return DetectionResult.success(answers, fillDetails);
    }
}
