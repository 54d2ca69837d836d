package com.orchestrator.exception;

/**
 * The base runtime exception for application-specific errors within the plan orchestrator.
 * <p>
 * Every subclass carries an {@link ErrorCode}, so a caller can tell a malformed reference from
 * a missing session without inspecting the message. Step-level failures are normally captured
 * into the failing step's result; only programmer errors (unknown session, wrong session state,
 * invalid plan or input) reach the caller as thrown exceptions.
 */
public class OrchestratorException extends RuntimeException {

    private final ErrorCode code;

    /**
     * Constructs a new OrchestratorException with the specified code and detail message.
     *
     * @param code    The error code classifying this failure.
     * @param message The detail message.
     */
    public OrchestratorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Constructs a new OrchestratorException with the specified code, detail message and cause.
     *
     * @param code    The error code classifying this failure.
     * @param message The detail message.
     * @param cause   The underlying cause; {@code null} is permitted.
     */
    public OrchestratorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
