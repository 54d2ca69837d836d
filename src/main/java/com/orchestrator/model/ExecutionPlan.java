package com.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.orchestrator.model.step.ConditionStep;
import com.orchestrator.model.step.PlanStep;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.Data;

/**
 * An execution plan produced by the external planner: the user's request and the ordered steps
 * that fulfil it. The engine treats a plan as immutable input.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class ExecutionPlan {

    /**
     * The plan id, optionally carrying a {@code -v<N>} version suffix (see {@link PlanId}).
     */
    private String id;

    /**
     * The natural-language request the plan was generated for.
     */
    private String userRequest;

    /**
     * The steps of the plan. Execution order is ascending {@code stepId}.
     */
    private List<PlanStep> steps = new ArrayList<>();

    private PlanStatus status = PlanStatus.EXECUTABLE;

    private Instant createdAt;

    @JsonIgnore
    public List<PlanStep> getOrderedSteps() {
        return steps.stream().sorted(Comparator.comparingInt(PlanStep::stepId)).toList();
    }

    @JsonIgnore
    public Optional<PlanStep> findStep(int stepId) {
        return steps.stream().filter(step -> step.stepId() == stepId).findFirst();
    }

    /**
     * A plan with at least one condition step needs the conditional executor.
     */
    @JsonIgnore
    public boolean hasConditionSteps() {
        return steps.stream().anyMatch(ConditionStep.class::isInstance);
    }

    @JsonIgnore
    public int getFirstStepId() {
        return steps.stream().mapToInt(PlanStep::stepId).min().orElse(0);
    }
}
