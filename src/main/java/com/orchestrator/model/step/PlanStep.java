package com.orchestrator.model.step;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Represents a single step within an {@link com.orchestrator.model.ExecutionPlan}.
 * <p>
 * The set of step kinds is closed: executors dispatch on the concrete record type rather than
 * probing for properties. {@code stepId} is unique within a plan and defines execution order.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FunctionCallStep.class, name = "function_call"),
        @JsonSubTypes.Type(value = UserInputStep.class, name = "user_input"),
        @JsonSubTypes.Type(value = ConditionStep.class, name = "condition")
})
public sealed interface PlanStep permits FunctionCallStep, UserInputStep, ConditionStep {

    int stepId();

    String description();

    @JsonIgnore
    StepType stepType();
}
