package com.orchestrator.exception;

/**
 * Wraps a failure reported or thrown by the external function dispatch capability.
 */
public class DispatchException extends OrchestratorException {

    private final String functionName;

    public DispatchException(String functionName, String message) {
        super(ErrorCode.DISPATCH_ERROR, "Function \"" + functionName + "\" execution failed: " + message);
        this.functionName = functionName;
    }

    public DispatchException(String functionName, Throwable cause) {
        super(ErrorCode.DISPATCH_ERROR, "Function \"" + functionName + "\" execution failed: " + describe(cause), cause);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
