package com.orchestrator.service.api;

import com.orchestrator.exception.InputRequiredException;
import com.orchestrator.model.step.InputField;

/**
 * Supplies values for user-input steps.
 * <p>
 * An interactive implementation prompts and returns the value. A non-interactive one throws
 * {@link InputRequiredException}, which makes the executor stop and report the step as pending.
 */
@FunctionalInterface
public interface InputRequester {

    /**
     * @param surfaceId   {@code user-input-<stepId>}.
     * @param componentId {@code field-<fieldId>}.
     * @param field       The field being asked for.
     * @return The raw value; it is converted according to the field type by the caller.
     * @throws InputRequiredException if the value is not available now.
     */
    Object requestInput(String surfaceId, String componentId, InputField field);

    /**
     * A requester that never has a value, used by sessions so that every user-input step pauses.
     */
    static InputRequester deferred() {
        return (surfaceId, componentId, field) -> {
            throw new InputRequiredException(surfaceId, componentId);
        };
    }
}
