package com.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanStatus {
    PENDING("pending"),
    EXECUTABLE("executable"),
    INCOMPLETE("incomplete");

    private final String value;

    PlanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
