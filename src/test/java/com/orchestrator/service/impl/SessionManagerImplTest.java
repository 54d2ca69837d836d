package com.orchestrator.service.impl;

import com.orchestrator.PlanFixtures;
import com.orchestrator.exception.InputValidationException;
import com.orchestrator.exception.InvalidSessionStateException;
import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.exception.SessionNotFoundException;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.result.UserInputResult;
import com.orchestrator.model.session.ExecutionSession;
import com.orchestrator.model.session.Platform;
import com.orchestrator.model.session.SessionQuery;
import com.orchestrator.model.session.SessionStatus;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.service.api.InputRequester;
import com.orchestrator.service.api.SessionStorage;
import com.orchestrator.service.api.StepTimeoutPolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.orchestrator.PlanFixtures.call;
import static com.orchestrator.PlanFixtures.field;
import static com.orchestrator.PlanFixtures.input;
import static com.orchestrator.PlanFixtures.literal;
import static com.orchestrator.PlanFixtures.plan;
import static com.orchestrator.PlanFixtures.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SessionManagerImplTest {

    private ExecutorService pool;
    private LocalFunctionRegistry functions;
    private SessionStorage storage;
    private SessionManagerImpl manager;
    private final AtomicInteger countedCalls = new AtomicInteger();
    private final AtomicInteger flakyFailuresLeft = new AtomicInteger();

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        functions = new LocalFunctionRegistry();
        functions.register("calculateBasePrice", params -> {
            double quantity = ((Number) params.get("quantity")).doubleValue();
            double subtotal = 500 * quantity;
            return Map.of("basePrice", Math.round(subtotal * 0.9), "category", params.get("category"),
                    "quantity", params.get("quantity"));
        });
        functions.register("calculateFinalPrice", params -> {
            double basePrice = ((Number) params.get("basePrice")).doubleValue();
            boolean warranty = Boolean.TRUE.equals(params.get("warranty"));
            return Map.of("finalPrice", warranty ? basePrice * 1.08 : basePrice);
        });
        functions.register("counted", params -> countedCalls.incrementAndGet());
        functions.register("flaky", params -> {
            if (flakyFailuresLeft.getAndDecrement() > 0) {
                throw new IllegalStateException("temporarily unavailable");
            }
            return "recovered";
        });
        storage = new InMemorySessionStorage(PlanFixtures.objectMapper());
        manager = manager(storage);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private SessionManagerImpl manager(SessionStorage sessionStorage) {
        InputValueConverter converter = new InputValueConverter();
        StepTimeoutPolicy timeouts = ConfiguredStepTimeoutPolicy.fixed(Duration.ofSeconds(5));
        StepExecutorSelector selector = new StepExecutorSelector(
                new StepExecutorImpl(functions, InputRequester.deferred(), timeouts, converter, pool),
                new ConditionalStepExecutor(functions, InputRequester.deferred(), timeouts, converter, pool,
                        new SpelConditionEvaluator()));
        return new SessionManagerImpl(sessionStorage, selector, converter);
    }

    private static Object resultOf(ExecutionSession session, int stepId) {
        return session.getStepResults().stream()
                .filter(result -> result.stepId() == stepId)
                .map(result -> ((FunctionCallResult) result).result())
                .findFirst()
                .orElseThrow();
    }

    private static double number(Object map, String key) {
        return ((Number) ((Map<?, ?>) map).get(key)).doubleValue();
    }

    @Test
    void createSession_startsPendingAtFirstStep() {
        ExecutionPlan plan = plan("pricing-v3", call(4, "counted", Map.of()), call(2, "counted", Map.of()));

        ExecutionSession session = manager.createSession(plan, Platform.WEB);

        assertThat(session.getId()).matches("session-[0-9a-f]{8}");
        assertThat(session.getStatus()).isEqualTo(SessionStatus.PENDING);
        assertThat(session.getCurrentStepId()).isEqualTo(2);
        assertThat(session.getBasePlanId()).isEqualTo("pricing");
        assertThat(session.getPlanVersion()).isEqualTo(3);
        assertThat(session.getPlatform()).isEqualTo(Platform.WEB);
        assertThat(session.getPendingInput()).isNull();
        assertThat(storage.loadSession(session.getId())).isPresent();
        assertThat(countedCalls).hasValue(0);
    }

    @Test
    void createSession_rejectsInvalidPlans() {
        assertThatThrownBy(() -> manager.createSession(plan("no-steps"), Platform.CLI))
                .isInstanceOf(PlanValidationException.class);
        assertThat(storage.listSessions(SessionQuery.all())).isEmpty();
    }

    @Test
    void multiplePauseResumeCycles_keepEveryEarlierResultReachable() {
        ExecutionSession session = manager.createSession(PlanFixtures.pricingPlan(), Platform.CLI);

        ExecutionSession first = manager.executeSession(session.getId());
        assertThat(first.getStatus()).isEqualTo(SessionStatus.WAITING_INPUT);
        assertThat(first.getPendingInput().stepId()).isEqualTo(1);
        assertThat(first.getPendingInput().surfaceId()).isEqualTo("user-input-1");
        assertThat(first.getCurrentStepId()).isEqualTo(1);
        assertThat(first.getStepResults()).isEmpty();

        ExecutionSession second = manager.resumeSession(session.getId(), Map.of("category", "electronics", "quantity", "5"));
        assertThat(second.getStatus()).isEqualTo(SessionStatus.WAITING_INPUT);
        assertThat(second.getPendingInput().stepId()).isEqualTo(3);
        assertThat(second.getCurrentStepId()).isEqualTo(3);
        assertThat(second.getStepResults()).extracting(StepResult::stepId).containsExactly(1, 2);
        assertThat(number(resultOf(second, 2), "basePrice")).isEqualTo(2250.0);
        assertThat(second.getContext()).containsEntry("category", "electronics");

        ExecutionSession third = manager.resumeSession(session.getId(), Map.of("warranty", "true"));
        assertThat(third.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(third.getPendingInput()).isNull();
        assertThat(third.getCurrentStepId()).isEqualTo(4);
        assertThat(third.getStepResults()).extracting(StepResult::stepId).containsExactly(1, 2, 3, 4);
        assertThat(third.getStepResults()).allMatch(StepResult::success);
        assertThat(number(resultOf(third, 4), "finalPrice")).isCloseTo(2430.0, within(0.001));
        assertThat(third.getResult().success()).isTrue();
        assertThat(third.getCompletedAt()).isNotNull();
    }

    @Test
    void resumeSession_appliesFieldDefaults() {
        ExecutionSession session = manager.createSession(PlanFixtures.pricingPlan(), Platform.CLI);
        manager.executeSession(session.getId());
        manager.resumeSession(session.getId(), Map.of("category", "books", "quantity", 5));

        ExecutionSession done = manager.resumeSession(session.getId(), Map.of());

        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(((UserInputResult) done.getStepResults().get(2)).values()).containsEntry("warranty", false);
        assertThat(number(resultOf(done, 4), "finalPrice")).isEqualTo(2250.0);
    }

    @Test
    void resumeSession_rejectsMissingRequiredValuesWithoutChangingTheSession() {
        ExecutionSession session = manager.createSession(PlanFixtures.pricingPlan(), Platform.CLI);
        manager.executeSession(session.getId());

        assertThatThrownBy(() -> manager.resumeSession(session.getId(), Map.of("category", "books")))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("quantity");

        ExecutionSession unchanged = manager.getSession(session.getId());
        assertThat(unchanged.getStatus()).isEqualTo(SessionStatus.WAITING_INPUT);
        assertThat(unchanged.getStepResults()).isEmpty();
    }

    @Test
    void resumeSession_requiresWaitingInput() {
        ExecutionSession session = manager.createSession(plan("simple", call(1, "counted", Map.of())), Platform.CLI);

        assertThatThrownBy(() -> manager.resumeSession(session.getId(), Map.of()))
                .isInstanceOf(InvalidSessionStateException.class)
                .hasMessageContaining("status 'pending'")
                .hasMessageContaining("waiting_input");
    }

    @Test
    void executeSession_persistsResultsUpToTheFailingStep() {
        ExecutionPlan plan = plan("failing",
                call(1, "add", Map.of("a", literal(1), "b", literal(2))),
                call(2, "divide", Map.of("a", ref("step.1.result"), "b", literal(0))),
                call(3, "counted", Map.of()));
        ExecutionSession session = manager.createSession(plan, Platform.CLI);

        ExecutionSession failed = manager.executeSession(session.getId());

        assertThat(failed.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(failed.getStepResults()).extracting(StepResult::stepId).containsExactly(1, 2);
        assertThat(failed.getStepResults().get(1).error()).contains("Division by zero");
        assertThat(failed.getResult().success()).isFalse();
        assertThat(failed.getCurrentStepId()).isEqualTo(2);
        assertThat(countedCalls).hasValue(0);
    }

    @Test
    void executeSession_rejectsFinishedSessionsAndUnknownIds() {
        ExecutionSession session = manager.createSession(plan("once", call(1, "counted", Map.of())), Platform.CLI);
        manager.executeSession(session.getId());

        assertThatThrownBy(() -> manager.executeSession(session.getId()))
                .isInstanceOf(InvalidSessionStateException.class);
        assertThatThrownBy(() -> manager.executeSession("session-unknown0"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void executeSession_continuesASessionLeftRunning() {
        ExecutionPlan plan = plan("interrupted",
                call(1, "counted", Map.of()),
                call(2, "echo", Map.of("previous", ref("step.1.result"))));
        ExecutionSession session = manager.createSession(plan, Platform.CLI);
        storage.updateSession(session.getId(), s -> {
            s.setStatus(SessionStatus.RUNNING);
            s.addStepResult(FunctionCallResult.succeeded(1, "counted", Map.of(), 41));
        });

        ExecutionSession recovered = manager.executeSession(session.getId());

        assertThat(recovered.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(countedCalls).hasValue(0);
        assertThat(resultOf(recovered, 2)).isEqualTo(Map.of("previous", 41));
    }

    @Test
    void retrySession_keepsOnlyResultsBeforeTheGivenStep() {
        flakyFailuresLeft.set(1);
        ExecutionPlan plan = plan("retry-me",
                call(1, "counted", Map.of()),
                call(2, "counted", Map.of()),
                call(3, "flaky", Map.of()));
        ExecutionSession original = manager.executeSession(manager.createSession(plan, Platform.CLI).getId());
        assertThat(original.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(countedCalls).hasValue(2);

        ExecutionSession retry = manager.retrySession(original.getId(), 2);

        assertThat(retry.getId()).isNotEqualTo(original.getId());
        assertThat(retry.getParentSessionId()).isEqualTo(original.getId());
        assertThat(retry.getRetryCount()).isEqualTo(1);
        assertThat(retry.getStatus()).isEqualTo(SessionStatus.PENDING);
        assertThat(retry.getCurrentStepId()).isEqualTo(2);
        assertThat(retry.getStepResults()).extracting(StepResult::stepId).containsExactly(1);
        assertThat(countedCalls).hasValue(2);

        ExecutionSession retried = manager.executeSession(retry.getId());

        assertThat(retried.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(retried.getStepResults()).extracting(StepResult::stepId).containsExactly(1, 2, 3);
        // step 1 was carried over, step 2 ran again
        assertThat(countedCalls).hasValue(3);

        ExecutionSession untouched = manager.getSession(original.getId());
        assertThat(untouched.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(untouched.getStepResults()).hasSize(3);
        assertThat(untouched.getRetryCount()).isZero();
    }

    @Test
    void retrySession_withoutStartStepRunsEverythingAgain() {
        flakyFailuresLeft.set(1);
        ExecutionPlan plan = plan("retry-all", call(1, "counted", Map.of()), call(2, "flaky", Map.of()));
        ExecutionSession original = manager.executeSession(manager.createSession(plan, Platform.CLI).getId());

        ExecutionSession retry = manager.retrySession(original.getId(), null);

        assertThat(retry.getStatus()).isEqualTo(SessionStatus.PENDING);
        assertThat(retry.getStepResults()).isEmpty();
        assertThat(retry.getCurrentStepId()).isEqualTo(1);
        assertThat(manager.getSessionStatus(retry.getId())).isEqualTo(SessionStatus.PENDING);

        ExecutionSession retried = manager.executeSession(retry.getId());

        assertThat(retried.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(countedCalls).hasValue(2);
    }

    @Test
    void retrySession_carriesOnlyVariablesWrittenByKeptSteps() {
        flakyFailuresLeft.set(1);
        ExecutionPlan plan = plan("retry-variables",
                input(1, field("vip", "boolean", true)),
                new ConditionStep(2, "vip check", "step.1.vip == true", List.of(3), List.of(), "isVip"),
                input(3, field("coupon", "text", false)),
                call(4, "flaky", Map.of()));
        ExecutionSession original = manager.createSession(plan, Platform.CLI);
        manager.executeSession(original.getId());
        manager.resumeSession(original.getId(), Map.of("vip", "yes"));
        ExecutionSession failed = manager.resumeSession(original.getId(), Map.of("coupon", "SAVE10"));
        assertThat(failed.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(failed.getContext()).containsKeys("vip", "isVip", "coupon");

        ExecutionSession retry = manager.retrySession(original.getId(), 3);

        assertThat(retry.getContext())
                .containsEntry("vip", true)
                .containsEntry("isVip", true)
                .doesNotContainKey("coupon");
        ExecutionSession waiting = manager.executeSession(retry.getId());
        assertThat(waiting.getStatus()).isEqualTo(SessionStatus.WAITING_INPUT);
        assertThat(waiting.getPendingInput().stepId()).isEqualTo(3);
    }

    @Test
    void retrySession_onlyForFailedSessions() {
        ExecutionSession session = manager.createSession(PlanFixtures.pricingPlan(), Platform.CLI);
        manager.executeSession(session.getId());

        assertThatThrownBy(() -> manager.retrySession(session.getId(), 1))
                .isInstanceOf(InvalidSessionStateException.class)
                .hasMessageContaining("Session must be failed");
    }

    @Test
    void cancelSession_failsAWaitingSession() {
        ExecutionSession session = manager.createSession(PlanFixtures.pricingPlan(), Platform.CLI);
        manager.executeSession(session.getId());

        ExecutionSession cancelled = manager.cancelSession(session.getId());

        assertThat(cancelled.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(cancelled.getPendingInput()).isNull();
        assertThat(cancelled.getResult().error()).isEqualTo("Session cancelled by user");
        assertThat(manager.getSessionStatus(session.getId())).isEqualTo(SessionStatus.FAILED);
        assertThatThrownBy(() -> manager.cancelSession(session.getId()))
                .isInstanceOf(InvalidSessionStateException.class);
    }

    @Test
    void listAndDeleteSessions() {
        ExecutionSession first = manager.createSession(plan("list-v1", call(1, "counted", Map.of())), Platform.CLI);
        ExecutionSession second = manager.createSession(plan("list-v2", call(1, "counted", Map.of())), Platform.CLI);

        assertThat(manager.listSessions(SessionQuery.builder().basePlanId("list").build())).hasSize(2);
        assertThat(manager.deleteSession(first.getId())).isTrue();
        assertThat(manager.listSessions(null)).extracting(ExecutionSession::getId).containsExactly(second.getId());
        assertThatThrownBy(() -> manager.getSession(first.getId())).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void getExecutionStats_reflectsFinishedSessions() {
        ExecutionPlan plan = plan("stats-plan", call(1, "counted", Map.of()));
        manager.executeSession(manager.createSession(plan, Platform.CLI).getId());
        manager.executeSession(manager.createSession(plan, Platform.CLI).getId());

        assertThat(manager.getExecutionStats("stats-plan").totalExecutions()).isEqualTo(2);
        assertThat(manager.getExecutionStats("stats-plan").successCount()).isEqualTo(2);
        assertThat(manager.getExecutionStats("stats-plan").failureCount()).isZero();
    }

    @Test
    void pausedSessionSurvivesARestart(@TempDir Path dataDir) {
        SessionManagerImpl beforeRestart = manager(new FileSessionStorage(PlanFixtures.objectMapper(), dataDir));
        ExecutionSession session = beforeRestart.createSession(PlanFixtures.pricingPlan(), Platform.CLI);
        beforeRestart.executeSession(session.getId());
        beforeRestart.resumeSession(session.getId(), Map.of("category", "garden", "quantity", "5"));

        SessionManagerImpl afterRestart = manager(new FileSessionStorage(PlanFixtures.objectMapper(), dataDir));
        ExecutionSession done = afterRestart.resumeSession(session.getId(), Map.of("warranty", true));

        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(number(resultOf(done, 4), "finalPrice")).isCloseTo(2430.0, within(0.001));
        assertThat(done.getUpdatedAt()).isAfterOrEqualTo(done.getCreatedAt());
        assertThat(done.getCompletedAt()).isBeforeOrEqualTo(Instant.now());
    }

    @Test
    void conditionalPlansAreRunWithTheConditionalExecutor() {
        ExecutionPlan plan = plan("conditional",
                input(1, field("vip", "boolean", true)),
                PlanFixtures.condition(2, "step.1.vip == true", List.of(3), List.of(4)),
                call(3, "echo", Map.of("discount", literal(20))),
                call(4, "echo", Map.of("discount", literal(0))));
        ExecutionSession session = manager.createSession(plan, Platform.CLI);
        manager.executeSession(session.getId());

        ExecutionSession done = manager.resumeSession(session.getId(), Map.of("vip", "yes"));

        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getStepResults()).extracting(StepResult::stepId).containsExactly(1, 2, 3);
        assertThat(done.getResult().finalResult()).isEqualTo(Map.of("discount", 20));
    }
}
