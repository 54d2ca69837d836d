package com.orchestrator.exception;

public class InputValidationException extends OrchestratorException {

    public InputValidationException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
