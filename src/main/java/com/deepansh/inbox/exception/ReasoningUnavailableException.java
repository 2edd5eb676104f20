package com.deepansh.inbox.exception;

/** The reasoning engine could not be reached after retries, or its circuit is open. */
public class ReasoningUnavailableException extends AgentException {

    public ReasoningUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
