package com.deepansh.inbox.model;

import java.util.Map;
import java.util.Optional;

/**
 * A callable catalog tool as returned by search. Read-only to the agent loop.
 *
 * @param requiredConnection the app connection that must be AUTHORIZED before
 *                           this tool may run; {@code null} for no-auth tools
 */
public record ToolDescriptor(
        String toolId,
        String app,
        String description,
        String requiredConnection,
        Map<String, Object> inputSchema
) {

    public Optional<String> connection() {
        return Optional.ofNullable(requiredConnection);
    }
}
