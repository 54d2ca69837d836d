package com.orchestrator.service.api;

import com.orchestrator.execution.ExecutionOptions;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ExecutionResult;

/**
 * Runs the steps of an execution plan in ascending step-id order.
 */
public interface StepExecutor {

    /**
     * Executes a plan from the beginning with default options.
     *
     * @param plan The {@link ExecutionPlan} to execute.
     * @return The outcome of the run. Step failures are reported in the result, not thrown.
     */
    default ExecutionResult execute(ExecutionPlan plan) {
        return execute(plan, ExecutionOptions.defaults());
    }

    /**
     * Executes a plan, skipping steps that already have a successful result in
     * {@link ExecutionOptions#previousResults()}.
     * <p>
     * The run stops at the first failed step, or at a user-input step whose value is not yet
     * available; in the latter case {@link ExecutionResult#pendingInput()} describes what is needed.
     *
     * @param plan    The {@link ExecutionPlan} to execute.
     * @param options Previous results, initial variables, input requester and step listener.
     * @return The outcome of the run.
     * @throws com.orchestrator.exception.PlanValidationException if the plan is structurally invalid.
     */
    ExecutionResult execute(ExecutionPlan plan, ExecutionOptions options);

    /**
     * Checks the structure of a plan without executing anything.
     *
     * @throws com.orchestrator.exception.PlanValidationException describing the first problem found.
     */
    void validate(ExecutionPlan plan);
}
