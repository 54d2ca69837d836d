package com.orchestrator.model.step;

import java.util.Map;

/**
 * A step that invokes a named function through the dispatch capability.
 *
 * @param stepId       Unique id of the step within its plan.
 * @param description  Human-readable purpose of the step.
 * @param functionName The name passed to the function dispatcher.
 * @param parameters   How to obtain each argument, keyed by parameter name.
 */
public record FunctionCallStep(int stepId, String description, String functionName,
                               Map<String, ParameterValue> parameters) implements PlanStep {

    public FunctionCallStep {
        parameters = parameters == null ? Map.of() : parameters;
    }

    @Override
    public StepType stepType() {
        return StepType.FUNCTION_CALL;
    }
}
