package com.orchestrator.service.impl;

import com.orchestrator.exception.PlanValidationException;
import com.orchestrator.execution.ExecutionOptions;
import com.orchestrator.model.ExecutionPlan;
import com.orchestrator.model.result.ConditionResult;
import com.orchestrator.model.result.ExecutionResult;
import com.orchestrator.model.result.FunctionCallResult;
import com.orchestrator.model.result.StepResult;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.service.api.InputRequester;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.orchestrator.PlanFixtures.call;
import static com.orchestrator.PlanFixtures.condition;
import static com.orchestrator.PlanFixtures.literal;
import static com.orchestrator.PlanFixtures.plan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionalStepExecutorTest {

    private ExecutorService pool;
    private ConditionalStepExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        executor = new ConditionalStepExecutor(new LocalFunctionRegistry(), InputRequester.deferred(),
                ConfiguredStepTimeoutPolicy.fixed(Duration.ofSeconds(5)), new InputValueConverter(), pool,
                new SpelConditionEvaluator());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void execute_runsTakenBranchAndSkipsTheOther() {
        ExecutionPlan plan = plan("branching",
                call(1, "add", Map.of("a", literal(2), "b", literal(3))),
                new ConditionStep(2, "big?", "step.1.result > 4", List.of(3), List.of(4), "isBig"),
                call(3, "echo", Map.of("size", literal("big"))),
                call(4, "echo", Map.of("size", literal("small"))),
                call(5, "echo", Map.of("always", literal(true))));
        List<Map<String, Object>> seenVariables = new java.util.ArrayList<>();

        ExecutionResult result = executor.execute(plan, ExecutionOptions.builder()
                .stepListener((stepResult, variables) -> seenVariables.add(Map.copyOf(variables)))
                .build());

        assertThat(result.success()).isTrue();
        assertThat(result.stepResults()).extracting(StepResult::stepId).containsExactly(1, 2, 3, 5);
        ConditionResult decision = (ConditionResult) result.stepResults().get(1);
        assertThat(decision.evaluatedResult()).isTrue();
        assertThat(decision.executedBranch()).isEqualTo("true");
        assertThat(decision.skippedSteps()).containsExactly(4);
        assertThat(((FunctionCallResult) result.stepResults().get(2)).result()).isEqualTo(Map.of("size", "big"));
        assertThat(seenVariables.get(1)).containsEntry("isBig", true);
    }

    @Test
    void execute_skipsNestedConditionBranchesTransitively() {
        ExecutionPlan plan = plan("nested",
                condition(1, "false", List.of(2), List.of(5)),
                condition(2, "true", List.of(3), List.of(4)),
                call(3, "echo", Map.of()),
                call(4, "echo", Map.of()),
                call(5, "echo", Map.of("ran", literal(5))));

        ExecutionResult result = executor.execute(plan);

        assertThat(result.success()).isTrue();
        assertThat(result.stepResults()).extracting(StepResult::stepId).containsExactly(1, 5);
        assertThat(((ConditionResult) result.stepResults().get(0)).skippedSteps()).containsExactly(2, 3, 4);
    }

    @Test
    void execute_conditionsSeeRunVariables() {
        ExecutionPlan plan = plan("variables",
                condition(1, "#tier == 'gold' and discount > 0", List.of(2), List.of(3)),
                call(2, "echo", Map.of("path", literal("gold"))),
                call(3, "echo", Map.of("path", literal("standard"))));

        ExecutionResult result = executor.execute(plan, ExecutionOptions.builder()
                .variables(Map.of("tier", "gold", "discount", 10))
                .build());

        assertThat(result.stepResults()).extracting(StepResult::stepId).containsExactly(1, 2);
    }

    @Test
    void execute_failsWhenConditionCannotBeEvaluated() {
        ExecutionPlan plan = plan("broken",
                condition(1, "step.9.result.flag == true", List.of(2), List.of()),
                call(2, "echo", Map.of()));

        ExecutionResult result = executor.execute(plan);

        assertThat(result.success()).isFalse();
        assertThat(result.stepResults()).hasSize(1);
        assertThat(result.error()).contains("Result for step 9 does not exist");
    }

    @Test
    void execute_replaysEarlierDecisionsWhenContinuing() {
        ExecutionPlan plan = plan("replay",
                condition(1, "true", List.of(2), List.of(3)),
                call(2, "echo", Map.of("branch", literal("taken"))),
                call(3, "echo", Map.of("branch", literal("skipped"))));

        ExecutionResult result = executor.execute(plan, ExecutionOptions.builder()
                .previousResults(List.of(ConditionResult.evaluated(1, "true", true, List.of(3))))
                .build());

        assertThat(result.success()).isTrue();
        assertThat(result.stepResults()).extracting(StepResult::stepId).containsExactly(1, 2);
    }

    @Test
    void validate_rejectsBranchTargetsThatDoNotExistOrPointBackwards() {
        assertThatThrownBy(() -> executor.validate(plan("missing-target",
                condition(1, "true", List.of(7), List.of()),
                call(2, "echo", Map.of()))))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("non-existent step 7");
        assertThatThrownBy(() -> executor.validate(plan("backwards",
                call(1, "echo", Map.of()),
                condition(2, "true", List.of(1), List.of()))))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("branches back to step 1");
    }

    @Test
    void validate_rejectsUnparsableConditions() {
        assertThatThrownBy(() -> executor.validate(plan("syntax",
                condition(1, "a ==== (", List.of(), List.of()))))
                .isInstanceOf(PlanValidationException.class)
                .hasMessageContaining("invalid condition");
    }
}
