package com.orchestrator.exception;

/**
 * Signals that a parameter reference could not be resolved against the recorded step results.
 * Used for malformed references and for paths that do not lead to a value.
 */
public class ParameterResolutionException extends OrchestratorException {

    private final String reference;

    public ParameterResolutionException(ErrorCode code, String reference, String message) {
        super(code, message);
        this.reference = reference;
    }

    public static ParameterResolutionException invalidFormat(String reference, String expectedFormat) {
        return new ParameterResolutionException(ErrorCode.INVALID_REFERENCE_FORMAT, reference,
                "Invalid parameter reference format: \"" + reference + "\". Expected: " + expectedFormat);
    }

    public static ParameterResolutionException fieldNotFound(String reference, String segment, int stepId) {
        return new ParameterResolutionException(ErrorCode.FIELD_NOT_FOUND, reference,
                "Field \"" + segment + "\" not found in step " + stepId + " result (reference \"" + reference + "\")");
    }

    public static ParameterResolutionException cannotAccessField(String reference, String segment, Object current) {
        String kind = current == null ? "null" : current.getClass().getSimpleName();
        return new ParameterResolutionException(ErrorCode.CANNOT_ACCESS_FIELD, reference,
                "Cannot access field \"" + segment + "\" on a " + kind + " value (reference \"" + reference + "\")");
    }

    public String getReference() {
        return reference;
    }
}
