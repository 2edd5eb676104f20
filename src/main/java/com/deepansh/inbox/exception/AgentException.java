package com.deepansh.inbox.exception;

/**
 * Root of the agent's error taxonomy.
 *
 * Thrown for conditions that must not be retried by Resilience4j
 * (bad credentials, unusable responses); listed under ignore-exceptions in
 * application.yml.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
