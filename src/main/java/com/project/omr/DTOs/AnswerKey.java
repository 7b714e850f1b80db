package com.project.omr.DTOs;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record AnswerKey(Map<Integer, String> answers) {

    public AnswerKey {
        if (answers == null) {
            throw new IllegalArgumentException("Answer key map is required");
        }
        Map<Integer, String> normalized = new TreeMap<>();
        for (Map.Entry<Integer, String> entry : answers.entrySet()) {
            Integer question = entry.getKey();
            String letter = entry.getValue();
            if (question == null || question < 1) {
                throw new IllegalArgumentException("Question numbers start at 1, got " + question);
            }
            if (letter == null || letter.isBlank()) {
                throw new IllegalArgumentException("Missing correct option for question " + question);
            }
            String option = letter.trim().toUpperCase(Locale.ROOT);
            if (option.length() != 1 || option.charAt(0) < 'A' || option.charAt(0) > 'Z') {
                throw new IllegalArgumentException("Question " + question + " needs a single option letter, got '" + letter + "'");
            }
            normalized.put(question, option);
        }
        answers = Collections.unmodifiableMap(normalized);
    }

    public static AnswerKey of(Map<Integer, String> answers) {
        return new AnswerKey(answers);
    }

    public int size() {
        return answers.size();
    }

    public String correctOption(int question) {
        return answers.get(question);
    }
}
