package com.orchestrator.model.step;

import java.util.List;

/**
 * A branch point. The condition is evaluated against the results recorded so far; the steps
 * listed in the taken branch run and the steps of the other branch are skipped.
 *
 * @param stepId         Unique id of the step within its plan.
 * @param description    Human-readable purpose of the step.
 * @param condition      A boolean expression, see {@code SpelConditionEvaluator}.
 * @param onTrue         Step ids to run when the condition holds.
 * @param onFalse        Step ids to run otherwise.
 * @param outputVariable Optional variable name receiving the evaluated boolean.
 */
public record ConditionStep(int stepId, String description, String condition,
                            List<Integer> onTrue, List<Integer> onFalse, String outputVariable)
        implements PlanStep {

    public ConditionStep {
        onTrue = onTrue == null ? List.of() : List.copyOf(onTrue);
        onFalse = onFalse == null ? List.of() : List.copyOf(onFalse);
    }

    @Override
    public StepType stepType() {
        return StepType.CONDITION;
    }

    public List<Integer> branch(boolean outcome) {
        return outcome ? onTrue : onFalse;
    }
}
