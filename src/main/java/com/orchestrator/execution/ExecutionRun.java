package com.orchestrator.execution;

import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.session.PendingInput;
import com.orchestrator.service.api.InputRequester;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state of one executor run: the resolver, the variables, the results recorded so
 * far and the steps a condition has ruled out. Not thread-safe; a run executes on one thread.
 */
public class ExecutionRun {

    private final ExecutionPlan plan;
    private final ParameterResolver resolver;
    private final Map<String, Object> variables;
    private final List<StepResult> results;
    private final Set<Integer> completedStepIds = new HashSet<>();
    private final Set<Integer> skippedStepIds = new HashSet<>();
    private final InputRequester inputRequester;
    private final StepListener listener;
    private final Instant startedAt = Instant.now();

    public ExecutionRun(ExecutionPlan plan, ExecutionOptions options, InputRequester defaultRequester) {
        this.plan = plan;
        this.resolver = ParameterResolver.fromStepResults(options.previousResults());
        this.variables = new LinkedHashMap<>(options.variables());
        this.results = new ArrayList<>(options.previousResults());
        this.inputRequester = options.inputRequester() != null ? options.inputRequester() : defaultRequester;
        this.listener = options.stepListener();
        options.previousResults().stream()
                .filter(StepResult::success)
                .forEach(result -> completedStepIds.add(result.stepId()));
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public ParameterResolver getResolver() {
        return resolver;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public InputRequester getInputRequester() {
        return inputRequester;
    }

    public List<StepResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public boolean isCompleted(int stepId) {
        return completedStepIds.contains(stepId);
    }

    public boolean isSkipped(int stepId) {
        return skippedStepIds.contains(stepId);
    }

    public void skip(Collection<Integer> stepIds) {
        skippedStepIds.addAll(stepIds);
    }

    /**
     * Appends the result, feeds the resolver and notifies the listener.
     */
    public void record(StepResult result) {
        results.add(result);
        resolver.record(result);
        if (result.success()) {
            completedStepIds.add(result.stepId());
        }
        listener.onStepRecorded(result, Collections.unmodifiableMap(variables));
    }

    public ExecutionResult complete() {
        return new ExecutionResult(plan.getId(), results, finalResult(), true, null, startedAt, Instant.now(), null);
    }

    public ExecutionResult fail(String error) {
        return new ExecutionResult(plan.getId(), results, finalResult(), false, error, startedAt, Instant.now(), null);
    }

    public ExecutionResult pause(PendingInput pendingInput) {
        return new ExecutionResult(plan.getId(), results, finalResult(), false, null, startedAt, null, pendingInput);
    }

    private Object finalResult() {
        Object last = null;
        for (StepResult result : results) {
            if (result.success() && result instanceof FunctionCallResult functionCall) {
                last = functionCall.result();
            }
        }
        return last;
    }
}
