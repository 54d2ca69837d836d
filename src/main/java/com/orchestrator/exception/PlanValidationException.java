package com.orchestrator.exception;

public class PlanValidationException extends OrchestratorException {

    public PlanValidationException(String message) {
        super(ErrorCode.INVALID_PLAN, message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_PLAN, message, cause);
    }
}
