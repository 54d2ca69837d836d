package com.orchestrator.exception;

/**
 * Signals that a user-input step cannot be satisfied synchronously and the run must suspend.
 * <p>
 * This is not a failure: the step executor converts it into a pending-input boundary on the
 * execution result, and the session manager turns that boundary into {@code waiting_input}.
 */
public class InputRequiredException extends OrchestratorException {

    private final String surfaceId;
    private final String componentId;

    public InputRequiredException(String surfaceId, String componentId) {
        super(ErrorCode.INPUT_REQUIRED, "User input required for " + surfaceId + "/" + componentId);
        this.surfaceId = surfaceId;
        this.componentId = componentId;
    }

    public String getSurfaceId() {
        return surfaceId;
    }

    public String getComponentId() {
        return componentId;
    }
}
