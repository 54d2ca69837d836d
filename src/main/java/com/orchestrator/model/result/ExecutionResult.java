package com.orchestrator.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.orchestrator.model.session.PendingInput;
import java.time.Instant;
import java.util.List;

/**
 * The outcome of one executor run over a plan.
 *
 * @param stepResults  Results recorded during this run, in execution order.
 * @param finalResult  The last successful function-call result, if any.
 * @param pendingInput Set only when the run stopped because a user-input step needs a value;
 *                     such a run is neither successful nor failed.
 */
public record ExecutionResult(String planId, List<StepResult> stepResults, Object finalResult, boolean success,
                              String error, Instant startedAt, Instant completedAt, PendingInput pendingInput) {

    public ExecutionResult {
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
    }

    @JsonIgnore
    public boolean isWaitingForInput() {
        return pendingInput != null;
    }
}
