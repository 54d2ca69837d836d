package com.orchestrator.model.step;

import java.util.List;

/**
 * The form a user-input step presents: an ordered list of fields.
 */
public record InputSchema(String version, List<InputField> fields) {

    public InputSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
