package com.project.omr.service;

import com.project.omr.DTOs.AnswerKey;
import com.project.omr.DTOs.DetectionResult;
import com.project.omr.DTOs.EvaluationResult;
import com.project.omr.DTOs.MarkStatus;
import com.project.omr.DTOs.ResultStatus;
import com.project.omr.exceptions.EmptyAnswerKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Component
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    public EvaluationResult evaluate(Map<Integer, String> detectedAnswers, AnswerKey answerKey) {
        if (answerKey == null || answerKey.size() == 0) {
            throw new EmptyAnswerKeyException();
        }

        List<Integer> correct = new ArrayList<>();
        List<Integer> wrong = new ArrayList<>();
        List<Integer> unmarked = new ArrayList<>();

        for (Map.Entry<Integer, String> entry : answerKey.answers().entrySet()) {
            int question = entry.getKey();
            String detected = detectedAnswers.get(question);

            if (detected == null || MarkStatus.UNMARKED.label().equals(detected)) {
                unmarked.add(question);
            } else if (detected.toUpperCase(Locale.ROOT).equals(entry.getValue())) {
                correct.add(question);
            } else {
                wrong.add(question);
            }
        }

        int total = answerKey.size();
        int score = correct.size();
        double percentage = round2(score * 100.0 / total);
        log.debug("Scored {}/{} ({}%), wrong={}, unmarked={}", score, total, percentage, wrong.size(), unmarked.size());

        return new EvaluationResult(ResultStatus.SUCCESS, score, total, percentage,
                List.copyOf(correct), List.copyOf(wrong), List.copyOf(unmarked),
                null, Collections.unmodifiableMap(new TreeMap<>(detectedAnswers)), null, null);
    }

    public EvaluationResult evaluate(DetectionResult detection, AnswerKey answerKey) {
        return evaluate(detection.detectedAnswers(), answerKey).withDetection(detection);
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
