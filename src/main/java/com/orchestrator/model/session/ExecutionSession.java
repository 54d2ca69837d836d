package com.orchestrator.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.StepResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * The durable state of one execution of a plan.
 * <p>
 * A session is persisted after every mutation. While {@link #getStatus()} is
 * {@link SessionStatus#WAITING_INPUT} the {@link #getPendingInput()} describes what the run
 * is waiting for; in every other state it is {@code null}.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class ExecutionSession {

    /**
     * Unique id of the form {@code session-<8 hex chars>}.
     */
    private String id;

    private String planId;

    /**
     * The plan id without its {@code -v<N>} version suffix.
     */
    private String basePlanId;

    private Integer planVersion;

    /**
     * A snapshot of the plan taken when the session was created.
     */
    private ExecutionPlan plan;

    private SessionStatus status = SessionStatus.PENDING;

    /**
     * The step the session is at. Never decreases.
     */
    private int currentStepId;

    /**
     * Every recorded step result, in execution order.
     */
    private List<StepResult> stepResults = new ArrayList<>();

    /**
     * Variables shared between steps: collected user input and condition outputs.
     */
    private Map<String, Object> context = new LinkedHashMap<>();

    private PendingInput pendingInput;

    private int retryCount;

    private String parentSessionId;

    private Platform platform = Platform.CLI;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    /**
     * The final execution result once the session has reached a terminal state.
     */
    private ExecutionResult result;

    public void addStepResult(StepResult stepResult) {
        stepResults.add(stepResult);
    }

    /**
     * Moves {@code currentStepId} forward; a lower id is ignored.
     */
    public void advanceTo(int stepId) {
        currentStepId = Math.max(currentStepId, stepId);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == SessionStatus.COMPLETED && result != null && result.success();
    }

    @JsonIgnore
    public boolean isUnsuccessful() {
        return status == SessionStatus.FAILED
                || (status == SessionStatus.COMPLETED && (result == null || !result.success()));
    }

    @JsonIgnore
    public Duration getDuration() {
        if (createdAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, completedAt);
    }
}
