package com.orchestrator.exception;

public class SessionNotFoundException extends OrchestratorException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }
}
