package com.orchestrator.service.api;

import com.orchestrator.execution.ConditionContext;

/**
 * Evaluates the boolean expression of a condition step.
 */
public interface ConditionEvaluator {

    /**
     * @return The boolean value of the expression.
     * @throws com.orchestrator.exception.ConditionEvaluationException if the expression cannot be
     *         evaluated or does not yield a boolean.
     */
    boolean evaluate(String condition, ConditionContext context);

    /**
     * Whether the expression is syntactically acceptable to this evaluator.
     */
    boolean supports(String condition);
}
