package com.orchestrator.model.session;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;

public enum SessionStatus {
    PENDING("pending"),
    RUNNING("running"),
    WAITING_INPUT("waiting_input"),
    COMPLETED("completed"),
    FAILED("failed");

    private static final Set<SessionStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED);

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Accepts both the wire value ({@code waiting_input}) and the constant name.
     */
    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
