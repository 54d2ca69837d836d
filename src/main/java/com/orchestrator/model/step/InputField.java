package com.orchestrator.model.step;

import java.util.Map;

/**
 * A single field of an {@link InputSchema}.
 *
 * @param id           The key under which the value is recorded.
 * @param type         One of {@code text}, {@code number}, {@code boolean}, {@code date},
 *                     {@code single_select} or {@code multi_select}.
 * @param label        Prompt shown to the user.
 * @param description  Optional help text.
 * @param required     Whether a value must be supplied.
 * @param defaultValue Value used when none is supplied.
 * @param config       Type-specific settings such as select options or date bounds.
 */
public record InputField(String id, String type, String label, String description,
                         boolean required, Object defaultValue, Map<String, Object> config) {
}
