package com.deepansh.inbox.exception;

/** The trigger stream could not be opened or was dropped. Always retryable. */
public class SubscriptionConnectionException extends AgentException {

    public SubscriptionConnectionException(String message) {
        super(message);
    }

    public SubscriptionConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
