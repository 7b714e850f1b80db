package com.project.omr.DTOs;

import java.util.List;

public record Row(int questionNumber, List<BubbleCandidate> bubbles, double meanY) {

    public Row {
        bubbles = List.copyOf(bubbles);
    }

    public static String optionLetter(int index) {
        return String.valueOf((char) ('A' + index));
    }
}
