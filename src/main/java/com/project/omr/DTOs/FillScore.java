package com.project.omr.DTOs;

public record FillScore(BubbleCandidate bubble, String option, double fillRatio) {}
