package com.orchestrator.service.impl;

import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.execution.ConditionContext;
import com.orchestrator.execution.ExecutionRun;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ConditionResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.model.step.PlanStep;
import com.orchestrator.service.api.ConditionEvaluator;
import com.orchestrator.service.api.FunctionDispatcher;
import com.orchestrator.service.api.InputRequester;
import com.orchestrator.service.api.StepTimeoutPolicy;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link StepExecutorImpl} that also runs condition steps.
 * <p>
 * When a condition is evaluated the steps of the branch not taken are skipped. If a skipped step
 * is itself a condition, both of its branches are skipped as well. The decision and the skipped
 * step ids are recorded in a {@link ConditionResult}, which is how a resumed run learns which steps
 * remain ruled out.
 */
@Slf4j
public class ConditionalStepExecutor extends StepExecutorImpl {

    private final ConditionEvaluator conditionEvaluator;

    public ConditionalStepExecutor(FunctionDispatcher dispatcher, InputRequester defaultInputRequester,
                                   StepTimeoutPolicy timeoutPolicy, InputValueConverter inputValueConverter,
                                   ExecutorService dispatchPool, ConditionEvaluator conditionEvaluator) {
        super(dispatcher, defaultInputRequester, timeoutPolicy, inputValueConverter, dispatchPool);
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * In addition to the base checks, every branch target must name a later step of the same plan
     * and every expression must be accepted by the evaluator.
     */
    @Override
    public void validate(ExecutionPlan plan) {
        super.validate(plan);
        Set<Integer> stepIds = plan.getSteps().stream().map(PlanStep::stepId).collect(Collectors.toSet());
        for (PlanStep step : plan.getSteps()) {
            if (!(step instanceof ConditionStep condition)) {
                continue;
            }
            if (condition.condition() == null || !conditionEvaluator.supports(condition.condition())) {
                throw new PlanValidationException("Invalid plan: step " + step.stepId()
                        + " has an invalid condition: " + condition.condition());
            }
            for (List<Integer> branch : List.of(condition.onTrue(), condition.onFalse())) {
                for (Integer target : branch) {
                    if (!stepIds.contains(target)) {
                        throw new PlanValidationException("Invalid plan: condition step " + step.stepId()
                                + " references non-existent step " + target);
                    }
                    if (target <= step.stepId()) {
                        throw new PlanValidationException("Invalid plan: condition step " + step.stepId()
                                + " branches back to step " + target);
                    }
                }
            }
        }
    }

    @Override
    protected void onRunStarted(ExecutionRun run) {
        for (StepResult previous : run.getResults()) {
            if (previous.success() && previous instanceof ConditionResult condition) {
                run.skip(condition.skippedSteps());
            }
        }
    }

    @Override
    protected StepResult executeCondition(ConditionStep step, ExecutionRun run) {
        boolean outcome;
        try {
            outcome = conditionEvaluator.evaluate(step.condition(),
                    new ConditionContext(run.getResolver(), run.getVariables()));
        } catch (OrchestratorException e) {
            return ConditionResult.failed(step.stepId(), step.condition(), e.getMessage());
        }

        Set<Integer> skipped = collectSkipped(step.branch(!outcome), run.getPlan());
        step.branch(outcome).forEach(skipped::remove);
        run.skip(skipped);
        if (step.outputVariable() != null && !step.outputVariable().isBlank()) {
            run.getVariables().put(step.outputVariable(), outcome);
        }
        log.info("Condition of step {} evaluated to {}; skipping steps {}", step.stepId(), outcome, skipped);
        return ConditionResult.evaluated(step.stepId(), step.condition(), outcome, List.copyOf(skipped));
    }

    private Set<Integer> collectSkipped(List<Integer> roots, ExecutionPlan plan) {
        Map<Integer, PlanStep> steps = plan.getSteps().stream()
                .collect(Collectors.toMap(PlanStep::stepId, Function.identity()));
        Set<Integer> skipped = new TreeSet<>();
        Deque<Integer> pending = new ArrayDeque<>(roots);
        while (!pending.isEmpty()) {
            Integer stepId = pending.pop();
            if (!skipped.add(stepId)) {
                continue;
            }
            if (steps.get(stepId) instanceof ConditionStep nested) {
                pending.addAll(nested.onTrue());
                pending.addAll(nested.onFalse());
            }
        }
        return skipped;
    }
}
