package com.orchestrator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.orchestrator.model.step.StepType;
import java.time.Instant;

/**
 * The recorded outcome of one plan step. Results are appended to a session in execution order
 * and are the only source from which a resolver is rebuilt when a session resumes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FunctionCallResult.class, name = "function_call"),
        @JsonSubTypes.Type(value = UserInputResult.class, name = "user_input"),
        @JsonSubTypes.Type(value = ConditionResult.class, name = "condition")
})
public sealed interface StepResult permits FunctionCallResult, UserInputResult, ConditionResult {

    int stepId();

    boolean success();

    /**
     * Failure description; {@code null} when the step succeeded.
     */
    String error();

    Instant executedAt();

    @JsonIgnore
    StepType stepType();
}
