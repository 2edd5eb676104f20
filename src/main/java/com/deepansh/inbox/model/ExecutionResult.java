package com.deepansh.inbox.model;

/**
 * Outcome of a single tool invocation. Exactly one of {@code data} or
 * {@code errorKind} is meaningful, depending on {@code success}.
 */
public record ExecutionResult(
        String toolId,
        boolean success,
        Object data,
        ErrorKind errorKind,
        String errorMessage
) {

    public static ExecutionResult success(String toolId, Object data) {
        return new ExecutionResult(toolId, true, data, null, null);
    }

    public static ExecutionResult failure(String toolId, ErrorKind kind, String message) {
        return new ExecutionResult(toolId, false, null, kind, message);
    }

    public boolean isRetryableFailure() {
        return !success && errorKind != null && errorKind.isRetryable();
    }
}
