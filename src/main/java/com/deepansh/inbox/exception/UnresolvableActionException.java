package com.deepansh.inbox.exception;

/** The reasoning engine answered, but not with any action the loop can run. */
public class UnresolvableActionException extends AgentException {

    public UnresolvableActionException(String message) {
        super(message);
    }

    public UnresolvableActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
