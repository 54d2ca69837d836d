package com.orchestrator.model.result;

import com.orchestrator.model.step.StepType;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of a condition step.
 *
 * @param evaluatedResult The boolean the expression evaluated to.
 * @param executedBranch  {@code "true"} or {@code "false"}.
 * @param skippedSteps    Every step id skipped because of this decision, including nested branches.
 */
public record ConditionResult(int stepId, boolean success, String error, Instant executedAt,
                              String condition, boolean evaluatedResult, String executedBranch,
                              List<Integer> skippedSteps) implements StepResult {

    public static ConditionResult evaluated(int stepId, String condition, boolean outcome, List<Integer> skipped) {
        return new ConditionResult(stepId, true, null, Instant.now(), condition, outcome,
                String.valueOf(outcome), List.copyOf(skipped));
    }

    public static ConditionResult failed(int stepId, String condition, String error) {
        return new ConditionResult(stepId, false, error, Instant.now(), condition, false, null, List.of());
    }

    @Override
    public StepType stepType() {
        return StepType.CONDITION;
    }
}
