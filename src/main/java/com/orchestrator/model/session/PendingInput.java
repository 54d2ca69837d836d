package com.orchestrator.model.session;

import com.orchestrator.model.step.InputSchema;

/**
 * What a paused session is waiting for.
 *
 * @param surfaceId Identifies the input surface, {@code user-input-<stepId>}.
 * @param stepId    The user-input step that paused the run.
 * @param schema    The fields the caller must supply on resume.
 */
public record PendingInput(String surfaceId, int stepId, InputSchema schema) {

    public static String surfaceIdFor(int stepId) {
        return "user-input-" + stepId;
    }
}
