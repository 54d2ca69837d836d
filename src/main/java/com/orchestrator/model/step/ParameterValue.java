package com.orchestrator.model.step;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.Map;

/**
 * Describes where the value of a function-call parameter comes from.
 * <p>
 * A parameter is either a {@link Literal} embedded in the plan, a {@link Reference} into the
 * result of an earlier step (see {@link com.orchestrator.execution.ParameterResolver} for the
 * grammar), or a {@link Composite} object whose fields are themselves parameter values.
 * On the wire the variant is selected by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ParameterValue.Literal.class, name = "literal"),
        @JsonSubTypes.Type(value = ParameterValue.Reference.class, name = "reference"),
        @JsonSubTypes.Type(value = ParameterValue.Composite.class, name = "composite")
})
public sealed interface ParameterValue
        permits ParameterValue.Literal, ParameterValue.Reference, ParameterValue.Composite {

    static Literal literal(Object value) {
        return new Literal(value);
    }

    static Reference reference(String path) {
        return new Reference(path);
    }

    static Composite composite(Map<String, ParameterValue> fields) {
        return new Composite(fields);
    }

    /**
     * A value taken verbatim from the plan. {@code null}, {@code 0}, {@code false} and empty
     * strings or collections are all legitimate literals.
     */
    record Literal(Object value) implements ParameterValue {
    }

    /**
     * A reference string such as {@code step.2.result.basePrice}.
     */
    record Reference(String value) implements ParameterValue {
    }

    /**
     * A nested object; each entry is resolved independently and the result keeps the same shape.
     */
    record Composite(Map<String, ParameterValue> value) implements ParameterValue {
    }
}
