package com.deepansh.inbox.exception;

import com.deepansh.inbox.model.ErrorKind;

/**
 * A catalog round-trip failed as a whole (transport error, timeout, error
 * status). The kind decides whether the caller may retry.
 */
public class ToolExecutionException extends AgentException {

    private final ErrorKind kind;

    public ToolExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ToolExecutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
