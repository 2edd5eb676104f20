package com.deepansh.inbox.exception;

import java.util.List;

/** A raw trigger event that cannot be accepted. Dropped at ingestion, never retried. */
public class MalformedEventException extends AgentException {

    private final List<String> violations;

    public MalformedEventException(String message, List<String> violations) {
        super(message + (violations.isEmpty() ? "" : ": " + String.join(", ", violations)));
        this.violations = List.copyOf(violations);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
