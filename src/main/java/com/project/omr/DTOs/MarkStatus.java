package com.project.omr.DTOs;

public enum MarkStatus {
    MARKED(null),
    UNMARKED("unmarked"),
    AMBIGUOUS("ambiguous");

    private final String label;

    MarkStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
