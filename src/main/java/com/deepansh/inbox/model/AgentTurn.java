package com.deepansh.inbox.model;

import java.util.Optional;

/**
 * One iteration of a run: what was attempted and what came back.
 * Append-only, scoped to a single run.
 */
public record AgentTurn(int stepIndex, ActionType action, Object input, Object output, String error) {

    public static AgentTurn ok(int stepIndex, ActionType action, Object input, Object output) {
        return new AgentTurn(stepIndex, action, input, output, null);
    }

    public static AgentTurn failed(int stepIndex, ActionType action, Object input, Object output, String error) {
        return new AgentTurn(stepIndex, action, input, output, error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
