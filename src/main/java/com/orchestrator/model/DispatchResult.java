package com.orchestrator.model;

/**
 * What a {@link com.orchestrator.service.api.FunctionDispatcher} returns for one call.
 */
public record DispatchResult(boolean success, Object result, String error) {

    public static DispatchResult ok(Object result) {
        return new DispatchResult(true, result, null);
    }

    public static DispatchResult error(String error) {
        return new DispatchResult(false, null, error);
    }
}
