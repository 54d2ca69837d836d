package com.orchestrator.model.result;

import com.orchestrator.model.step.StepType;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a function-call step.
 *
 * @param parameters The resolved arguments actually passed to the function.
 * @param result     The function's return value; {@code null} on failure.
 */
public record FunctionCallResult(int stepId, boolean success, String error, Instant executedAt,
                                 String functionName, Map<String, Object> parameters, Object result)
        implements StepResult {

    public static FunctionCallResult succeeded(int stepId, String functionName, Map<String, Object> parameters,
                                               Object result) {
        return new FunctionCallResult(stepId, true, null, Instant.now(), functionName, parameters, result);
    }

    public static FunctionCallResult failed(int stepId, String functionName, Map<String, Object> parameters,
                                            String error) {
        return new FunctionCallResult(stepId, false, error, Instant.now(), functionName, parameters, null);
    }

    @Override
    public StepType stepType() {
        return StepType.FUNCTION_CALL;
    }
}
