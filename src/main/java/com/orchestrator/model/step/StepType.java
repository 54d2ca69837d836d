package com.orchestrator.model.step;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The wire names of the three step kinds. Used for both plan steps and step results.
 */
public enum StepType {
    FUNCTION_CALL("function_call"),
    USER_INPUT("user_input"),
    CONDITION("condition");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
