package com.orchestrator.execution;

import com.orchestrator.model.result.StepResult;
import java.util.Map;

/**
 * Callback invoked after each step result is recorded and before the next step starts.
 * The session manager uses it to persist progress step by step.
 */
@FunctionalInterface
public interface StepListener {

    StepListener NONE = (result, variables) -> { };

    /**
     * @param result    The result just recorded.
     * @param variables A read-only view of the run's variables after the step.
     */
    void onStepRecorded(StepResult result, Map<String, Object> variables);
}
