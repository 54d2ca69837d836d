package com.orchestrator.execution;

import java.util.Map;

/**
 * What a condition expression can see: the recorded step results through the resolver and the
 * run's variables.
 */
public record ConditionContext(ParameterResolver resolver, Map<String, Object> variables) {
}
