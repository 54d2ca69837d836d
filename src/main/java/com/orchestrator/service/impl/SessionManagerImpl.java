package com.orchestrator.service.impl;

import com.orchestrator.exception.InvalidSessionStateException;
import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.exception.SessionNotFoundException;
import com.orchestrator.execution.ExecutionOptions;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.PlanId;
import com.orchestrator.model.result.ConditionResult;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.result.UserInputResult;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.ExecutionStats;
import com.orchestrator.model.session.PendingInput;
import com.orchestrator.model.session.Platform;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.model.session.SessionStatus;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.model.step.PlanStep;
import com.orchestrator.service.api.InputRequester;
import com.orchestrator.service.api.SessionManager;
import com.orchestrator.service.api.SessionStorage;
import com.orchestrator.service.api.StepExecutor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The session state machine on top of a {@link StepExecutor} and a {@link SessionStorage}.
 * <p>
 * Sessions never prompt: every run uses {@link InputRequester#deferred()}, so the first user-input
 * step without a value pauses the session in {@code waiting_input}. Each recorded step is written
 * to storage before the next step starts, and every continuation rebuilds its resolver from the
 * persisted results, so any number of pause/resume cycles, and a process restart between them,
 * see the same state.
 */
@Service
@Slf4j
public class SessionManagerImpl implements SessionManager {

    static final String CANCELLED_MESSAGE = "Session cancelled by user";

    private final SessionStorage storage;
    private final StepExecutorSelector executorSelector;
    private final InputValueConverter inputValueConverter;

    public SessionManagerImpl(SessionStorage storage, StepExecutorSelector executorSelector,
                              InputValueConverter inputValueConverter) {
        this.storage = storage;
        this.executorSelector = executorSelector;
        this.inputValueConverter = inputValueConverter;
    }

    @Override
    public ExecutionSession createSession(ExecutionPlan plan, Platform platform) {
        if (plan == null || plan.getId() == null || plan.getId().isBlank()) {
            throw new PlanValidationException("Plan must have an id");
        }
        executorSelector.select(plan).validate(plan);

        PlanId planId = PlanId.parse(plan.getId());
        Instant now = Instant.now();
        ExecutionSession session = new ExecutionSession();
        session.setId(newSessionId());
        session.setPlanId(plan.getId());
        session.setBasePlanId(planId.basePlanId());
        session.setPlanVersion(planId.version());
        session.setPlan(plan);
        session.setStatus(SessionStatus.PENDING);
        session.setCurrentStepId(plan.getFirstStepId());
        session.setPlatform(platform != null ? platform : Platform.CLI);
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        storage.saveSession(session);
        log.info("Created session {} for plan '{}'", session.getId(), plan.getId());
        return session;
    }

    @Override
    public ExecutionSession executeSession(String sessionId) {
        ExecutionSession session = getSession(sessionId);
        if (session.getStatus() != SessionStatus.PENDING && session.getStatus() != SessionStatus.RUNNING) {
            throw new InvalidSessionStateException(sessionId, "execute", session.getStatus(), "pending or running");
        }
        if (session.getStatus() == SessionStatus.RUNNING) {
            log.warn("Session {} was left running, continuing from step {}", sessionId, session.getCurrentStepId());
        }
        storage.updateSession(sessionId, s -> s.setStatus(SessionStatus.RUNNING));
        return continueRun(sessionId);
    }

    @Override
    public ExecutionSession resumeSession(String sessionId, Map<String, Object> values) {
        ExecutionSession session = getSession(sessionId);
        if (session.getStatus() != SessionStatus.WAITING_INPUT || session.getPendingInput() == null) {
            throw new InvalidSessionStateException(sessionId, "resume", session.getStatus(), "waiting_input");
        }
        PendingInput pending = session.getPendingInput();
        Map<String, Object> normalized = inputValueConverter.normalize(pending.schema(), values);
        log.info("Resuming session {} at step {} with fields {}", sessionId, pending.stepId(), normalized.keySet());

        storage.updateSession(sessionId, s -> {
            s.addStepResult(UserInputResult.collected(pending.stepId(), normalized));
            s.getContext().putAll(normalized);
            s.advanceTo(pending.stepId());
            s.setPendingInput(null);
            s.setStatus(SessionStatus.RUNNING);
        });
        return continueRun(sessionId);
    }

    @Override
    public ExecutionSession retrySession(String sessionId, Integer fromStepId) {
        ExecutionSession original = getSession(sessionId);
        if (original.getStatus() != SessionStatus.FAILED) {
            throw new InvalidSessionStateException(sessionId, "retry", original.getStatus(), "failed");
        }

        List<StepResult> kept = new ArrayList<>();
        if (fromStepId != null) {
            original.getStepResults().stream()
                    .filter(result -> result.success() && result.stepId() < fromStepId)
                    .forEach(kept::add);
        }
        Set<Integer> keptIds = kept.stream().map(StepResult::stepId).collect(Collectors.toSet());
        ExecutionPlan plan = original.getPlan();

        Instant now = Instant.now();
        ExecutionSession retry = new ExecutionSession();
        retry.setId(newSessionId());
        retry.setPlanId(original.getPlanId());
        retry.setBasePlanId(original.getBasePlanId());
        retry.setPlanVersion(original.getPlanVersion());
        retry.setPlan(plan);
        retry.setStatus(SessionStatus.PENDING);
        retry.setStepResults(kept);
        retry.setContext(variablesProducedBy(kept, plan));
        retry.setCurrentStepId(plan.getOrderedSteps().stream()
                .mapToInt(PlanStep::stepId)
                .filter(id -> !keptIds.contains(id))
                .findFirst()
                .orElse(plan.getFirstStepId()));
        retry.setRetryCount(original.getRetryCount() + 1);
        retry.setParentSessionId(original.getId());
        retry.setPlatform(original.getPlatform());
        retry.setCreatedAt(now);
        retry.setUpdatedAt(now);
        storage.saveSession(retry);
        log.info("Retrying session {} as {} (attempt {}, {} results kept)", sessionId, retry.getId(),
                retry.getRetryCount(), kept.size());
        return retry;
    }

    @Override
    public ExecutionSession cancelSession(String sessionId) {
        ExecutionSession session = getSession(sessionId);
        if (session.getStatus().isTerminal()) {
            throw new InvalidSessionStateException(sessionId, "cancel", session.getStatus(),
                    "pending, running or waiting_input");
        }
        log.info("Cancelling session {}", sessionId);
        return storage.updateSession(sessionId, s -> finish(s, new ExecutionResult(s.getPlanId(), s.getStepResults(),
                null, false, CANCELLED_MESSAGE, s.getCreatedAt(), Instant.now(), null)));
    }

    @Override
    public ExecutionSession getSession(String sessionId) {
        return storage.loadSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public SessionStatus getSessionStatus(String sessionId) {
        return getSession(sessionId).getStatus();
    }

    @Override
    public List<ExecutionSession> listSessions(SessionQuery query) {
        return storage.listSessions(query != null ? query : SessionQuery.all());
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return storage.deleteSession(sessionId);
    }

    @Override
    public ExecutionStats getExecutionStats(String planId) {
        return storage.getExecutionStats(planId);
    }

    private ExecutionSession continueRun(String sessionId) {
        ExecutionSession session = getSession(sessionId);
        ExecutionOptions options = ExecutionOptions.builder()
                .previousResults(session.getStepResults())
                .variables(session.getContext())
                .inputRequester(InputRequester.deferred())
                .stepListener((stepResult, variables) -> storage.updateSession(sessionId, s -> {
                    s.addStepResult(stepResult);
                    s.setContext(new LinkedHashMap<>(variables));
                    s.advanceTo(stepResult.stepId());
                }))
                .build();

        ExecutionResult result;
        try {
            result = executorSelector.select(session.getPlan()).execute(session.getPlan(), options);
        } catch (RuntimeException e) {
            log.error("Execution of session {} aborted", sessionId, e);
            markFailed(sessionId, e);
            throw e;
        }

        if (result.isWaitingForInput()) {
            PendingInput pending = result.pendingInput();
            log.info("Session {} is waiting for input at step {}", sessionId, pending.stepId());
            return storage.updateSession(sessionId, s -> {
                s.advanceTo(pending.stepId());
                s.setPendingInput(pending);
                s.setStatus(SessionStatus.WAITING_INPUT);
            });
        }
        log.info("Session {} {}", sessionId, result.success() ? "completed" : "failed: " + result.error());
        return storage.updateSession(sessionId, s -> finish(s, result));
    }

    // Only variables written by kept steps survive; steps that run again write theirs anew.
    private static Map<String, Object> variablesProducedBy(List<StepResult> kept, ExecutionPlan plan) {
        Map<String, Object> variables = new LinkedHashMap<>();
        for (StepResult result : kept) {
            if (result instanceof UserInputResult userInput) {
                variables.putAll(userInput.values());
            } else if (result instanceof ConditionResult condition) {
                plan.findStep(condition.stepId())
                        .filter(ConditionStep.class::isInstance)
                        .map(step -> ((ConditionStep) step).outputVariable())
                        .filter(name -> !name.isBlank())
                        .ifPresent(name -> variables.put(name, condition.evaluatedResult()));
            }
        }
        return variables;
    }

    private void markFailed(String sessionId, RuntimeException cause) {
        try {
            storage.updateSession(sessionId, s -> finish(s, new ExecutionResult(s.getPlanId(), s.getStepResults(),
                    null, false, cause.getMessage(), s.getCreatedAt(), Instant.now(), null)));
        } catch (RuntimeException e) {
            log.error("Could not record the failure of session {}", sessionId, e);
            cause.addSuppressed(e);
        }
    }

    private static void finish(ExecutionSession session, ExecutionResult result) {
        session.setStatus(result.success() ? SessionStatus.COMPLETED : SessionStatus.FAILED);
        session.setResult(result);
        session.setPendingInput(null);
        session.setCompletedAt(result.completedAt() != null ? result.completedAt() : Instant.now());
    }

    private static String newSessionId() {
        return "session-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
