package com.orchestrator.model.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The surface a session was started from.
 */
public enum Platform {
    CLI("cli"),
    WEB("web");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Platform fromValue(String value) {
        for (Platform platform : values()) {
            if (platform.value.equalsIgnoreCase(value)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }
}
