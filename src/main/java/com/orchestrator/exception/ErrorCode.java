package com.orchestrator.exception;

/**
 * Stable, machine-readable identifiers for every failure the orchestrator can report.
 * <p>
 * The codes are carried by {@link OrchestratorException} and are also the prefix of the
 * {@code error} text recorded in a failed step result, which lets callers branch on the
 * failure kind without parsing messages.
 */
public enum ErrorCode {
    INVALID_REFERENCE_FORMAT,
    STEP_RESULT_NOT_FOUND,
    FIELD_NOT_FOUND,
    CANNOT_ACCESS_FIELD,
    STEP_TIMEOUT,
    DISPATCH_ERROR,
    SESSION_NOT_FOUND,
    INVALID_SESSION_STATE,
    INPUT_REQUIRED,
    INVALID_INPUT,
    INVALID_PLAN,
    CONDITION_ERROR,
    STORAGE_ERROR
}
