package com.deepansh.inbox.model;

/**
 * Classification of a failed tool invocation. Drives the execute retry policy.
 */
public enum ErrorKind {
    TIMEOUT(true),
    TRANSIENT(true),
    INVALID_INPUT(false),
    PERMISSION_DENIED(false),
    NOT_FOUND(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
