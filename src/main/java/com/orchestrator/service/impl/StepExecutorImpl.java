package com.orchestrator.service.impl;

import com.orchestrator.exception.DispatchException;
import com.orchestrator.exception.InputRequiredException;
import com.orchestrator.exception.OrchestratorException;
import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.exception.StepTimeoutException;
import com.orchestrator.execution.ExecutionOptions;
import com.orchestrator.execution.ExecutionRun;
import com.orchestrator.model.DispatchResult;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ConditionResult;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.result.UserInputResult;
import com.orchestrator.model.session.PendingInput;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.model.step.FunctionCallStep;
import com.orchestrator.model.step.InputField;
import com.orchestrator.model.step.PlanStep;
import com.orchestrator.model.step.UserInputStep;
import com.orchestrator.service.api.FunctionDispatcher;
import com.orchestrator.service.api.InputRequester;
import com.orchestrator.service.api.StepExecutor;
import com.orchestrator.service.api.StepTimeoutPolicy;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes plans step by step.
 * <p>
 * Function calls are dispatched on a worker pool and raced against the configured timeout with a
 * resilience4j {@link TimeLimiter}. A call that times out is abandoned, not interrupted. Any
 * failure stops the run; results recorded before it are kept.
 * <p>
 * This executor does not understand condition steps and fails them. Plans that branch are run by
 * {@link ConditionalStepExecutor}.
 */
@Slf4j
public class StepExecutorImpl implements StepExecutor {

    private final FunctionDispatcher dispatcher;
    private final InputRequester defaultInputRequester;
    private final StepTimeoutPolicy timeoutPolicy;
    private final InputValueConverter inputValueConverter;
    private final ExecutorService dispatchPool;

    public StepExecutorImpl(FunctionDispatcher dispatcher, InputRequester defaultInputRequester,
                            StepTimeoutPolicy timeoutPolicy, InputValueConverter inputValueConverter,
                            ExecutorService dispatchPool) {
        this.dispatcher = dispatcher;
        this.defaultInputRequester = defaultInputRequester;
        this.timeoutPolicy = timeoutPolicy;
        this.inputValueConverter = inputValueConverter;
        this.dispatchPool = dispatchPool;
    }

    @Override
    public ExecutionResult execute(ExecutionPlan plan, ExecutionOptions options) {
        validate(plan);
        ExecutionRun run = new ExecutionRun(plan, options, defaultInputRequester);
        onRunStarted(run);
        log.info("Executing plan '{}' ({} steps, {} already done)", plan.getId(), plan.getSteps().size(),
                options.previousResults().stream().filter(StepResult::success).count());

        for (PlanStep step : plan.getOrderedSteps()) {
            if (run.isCompleted(step.stepId())) {
                log.debug("Step {} already has a result, not executing it again", step.stepId());
                continue;
            }
            if (run.isSkipped(step.stepId())) {
                log.info("Skipping step {}: not on the taken branch", step.stepId());
                continue;
            }

            log.info("Executing Step {}: {}", step.stepId(), step.description());
            StepResult result;
            try {
                result = executeStep(step, run);
            } catch (InputRequiredException e) {
                UserInputStep inputStep = (UserInputStep) step;
                log.info("Step {} is waiting for user input", step.stepId());
                return run.pause(new PendingInput(PendingInput.surfaceIdFor(step.stepId()), step.stepId(),
                        inputStep.schema()));
            }

            run.record(result);
            if (!result.success()) {
                log.error("Step {} failed: {}", step.stepId(), result.error());
                return run.fail(result.error());
            }
            log.info("Step {} successful.", step.stepId());
        }
        return run.complete();
    }

    @Override
    public void validate(ExecutionPlan plan) {
        if (plan == null) {
            throw new PlanValidationException("Plan is missing");
        }
        if (plan.getSteps() == null || plan.getSteps().isEmpty()) {
            throw new PlanValidationException("Plan '" + plan.getId() + "' has no steps");
        }
        Set<Integer> seen = new HashSet<>();
        for (PlanStep step : plan.getSteps()) {
            if (step.stepId() <= 0) {
                throw new PlanValidationException("Invalid plan: step ids must be positive, found " + step.stepId());
            }
            if (!seen.add(step.stepId())) {
                throw new PlanValidationException("Invalid plan: duplicate step id " + step.stepId());
            }
            if (step instanceof FunctionCallStep functionCall
                    && (functionCall.functionName() == null || functionCall.functionName().isBlank())) {
                throw new PlanValidationException("Invalid plan: step " + step.stepId() + " has no function name");
            }
            if (step instanceof UserInputStep userInput && userInput.schema() == null) {
                throw new PlanValidationException("Invalid plan: step " + step.stepId() + " has no input schema");
            }
        }
    }

    /**
     * Called once the run state is built and before any step executes.
     */
    protected void onRunStarted(ExecutionRun run) {
    }

    protected StepResult executeStep(PlanStep step, ExecutionRun run) {
        if (step instanceof FunctionCallStep functionCall) {
            return executeFunctionCall(functionCall, run);
        }
        if (step instanceof UserInputStep userInput) {
            return executeUserInput(userInput, run);
        }
        return executeCondition((ConditionStep) step, run);
    }

    protected StepResult executeCondition(ConditionStep step, ExecutionRun run) {
        return ConditionResult.failed(step.stepId(), step.condition(),
                "Condition steps are not supported by this executor; use the conditional executor");
    }

    private StepResult executeFunctionCall(FunctionCallStep step, ExecutionRun run) {
        Map<String, Object> parameters = Map.of();
        try {
            parameters = run.getResolver().resolveAll(step.parameters());
            log.debug("  Resolved parameters for step {}: {}", step.stepId(), parameters);
            if (!dispatcher.has(step.functionName())) {
                throw new DispatchException(step.functionName(), "function is not registered");
            }
            DispatchResult dispatched = dispatch(step, parameters);
            if (!dispatched.success()) {
                throw new DispatchException(step.functionName(), dispatched.error());
            }
            return FunctionCallResult.succeeded(step.stepId(), step.functionName(), parameters, dispatched.result());
        } catch (OrchestratorException e) {
            return FunctionCallResult.failed(step.stepId(), step.functionName(), parameters, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FunctionCallResult.failed(step.stepId(), step.functionName(), parameters,
                    new DispatchException(step.functionName(), "interrupted").getMessage());
        } catch (Exception e) {
            log.error("An unexpected error occurred during step {}", step.stepId(), e);
            return FunctionCallResult.failed(step.stepId(), step.functionName(), parameters,
                    new DispatchException(step.functionName(), e).getMessage());
        }
    }

    private DispatchResult dispatch(FunctionCallStep step, Map<String, Object> parameters) throws Exception {
        Duration timeout = timeoutPolicy.timeoutFor(step);
        if (timeout.isZero()) {
            return dispatcher.execute(step.functionName(), parameters);
        }
        TimeLimiter timeLimiter = TimeLimiter.of("step-" + step.stepId(), TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(false)
                .build());
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> dispatchPool.submit(() -> dispatcher.execute(step.functionName(), parameters)));
        } catch (TimeoutException e) {
            throw new StepTimeoutException(step.stepId(), step.functionName(), timeout, e);
        }
    }

    private StepResult executeUserInput(UserInputStep step, ExecutionRun run) {
        String surfaceId = PendingInput.surfaceIdFor(step.stepId());
        Map<String, Object> values = new LinkedHashMap<>();
        try {
            for (InputField field : step.schema().fields()) {
                Object raw = run.getInputRequester().requestInput(surfaceId, "field-" + field.id(), field);
                Object value = inputValueConverter.convert(field, raw);
                if (value != null) {
                    values.put(field.id(), value);
                }
            }
        } catch (InputRequiredException e) {
            throw e;
        } catch (OrchestratorException e) {
            return UserInputResult.failed(step.stepId(), e.getMessage());
        }
        run.getVariables().putAll(values);
        return UserInputResult.collected(step.stepId(), values);
    }
}
