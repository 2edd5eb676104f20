package com.deepansh.inbox.exception;

public class SessionCreationException extends AgentException {

    private final String userId;

    public SessionCreationException(String userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
