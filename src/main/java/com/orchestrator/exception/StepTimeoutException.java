package com.orchestrator.exception;

import java.time.Duration;

/**
 * Raised when a function-call step does not finish within its configured timeout.
 */
public class StepTimeoutException extends OrchestratorException {

    public StepTimeoutException(int stepId, String functionName, Duration timeout, Throwable cause) {
        super(ErrorCode.STEP_TIMEOUT,
                "Step " + stepId + " (" + functionName + ") execution timed out after " + timeout.toMillis() + "ms", cause);
    }
}
