package com.orchestrator.exception;

public class ConditionEvaluationException extends OrchestratorException {

    public ConditionEvaluationException(String condition, String message, Throwable cause) {
        super(ErrorCode.CONDITION_ERROR, "Failed to evaluate condition \"" + condition + "\": " + message, cause);
    }
}
