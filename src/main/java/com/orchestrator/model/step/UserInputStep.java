package com.orchestrator.model.step;

/**
 * A step that asks a human for one or more values described by an {@link InputSchema}.
 * Later steps address the collected values as {@code step.<stepId>.<fieldId>}.
 *
 * @param stepId      Unique id of the step within its plan.
 * @param description Human-readable purpose of the step.
 * @param schema      The fields to collect.
 * @param outputName  Optional label for the collected values.
 */
public record UserInputStep(int stepId, String description, InputSchema schema, String outputName)
        implements PlanStep {

    @Override
    public StepType stepType() {
        return StepType.USER_INPUT;
    }
}
