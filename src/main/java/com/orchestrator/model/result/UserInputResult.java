package com.orchestrator.model.result;

import com.orchestrator.model.step.StepType;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a user-input step: the collected values keyed by field id.
 */
public record UserInputResult(int stepId, boolean success, String error, Instant executedAt,
                              Map<String, Object> values, boolean skipped) implements StepResult {

    public static UserInputResult collected(int stepId, Map<String, Object> values) {
        return new UserInputResult(stepId, true, null, Instant.now(), values, false);
    }

    public static UserInputResult failed(int stepId, String error) {
        return new UserInputResult(stepId, false, error, Instant.now(), Map.of(), false);
    }

    @Override
    public StepType stepType() {
        return StepType.USER_INPUT;
    }
}
