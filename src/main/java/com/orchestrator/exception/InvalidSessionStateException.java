package com.orchestrator.exception;

import com.orchestrator.model.session.SessionStatus;

/**
 * Thrown when a lifecycle operation is invoked on a session whose status does not allow it,
 * for example resuming a session that is not waiting for input.
 */
public class InvalidSessionStateException extends OrchestratorException {

    private final SessionStatus actual;

    public InvalidSessionStateException(String sessionId, String operation, SessionStatus actual, String expected) {
        super(ErrorCode.INVALID_SESSION_STATE,
                "Cannot " + operation + " session " + sessionId + " with status '" + actual.getValue()
                        + "'. Session must be " + expected + ".");
        this.actual = actual;
    }

    public SessionStatus getActual() {
        return actual;
    }
}
