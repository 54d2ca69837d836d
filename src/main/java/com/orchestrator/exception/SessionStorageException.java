package com.orchestrator.exception;

public class SessionStorageException extends OrchestratorException {

    public SessionStorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
