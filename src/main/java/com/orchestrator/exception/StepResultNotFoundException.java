package com.orchestrator.exception;

import java.util.List;

/**
 * Thrown when a reference points at a step that has no recorded result in the current run.
 * The sorted list of step ids that do have results is kept for diagnostics.
 */
public class StepResultNotFoundException extends OrchestratorException {

    private final int stepId;
    private final List<Integer> availableStepIds;

    public StepResultNotFoundException(int stepId, List<Integer> availableStepIds) {
        super(ErrorCode.STEP_RESULT_NOT_FOUND,
                "Result for step " + stepId + " does not exist. Available steps: " + availableStepIds);
        this.stepId = stepId;
        this.availableStepIds = List.copyOf(availableStepIds);
    }

    public int getStepId() {
        return stepId;
    }

    public List<Integer> getAvailableStepIds() {
        return availableStepIds;
    }
}
