package com.project.omr.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String wireValue;

    ResultStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
