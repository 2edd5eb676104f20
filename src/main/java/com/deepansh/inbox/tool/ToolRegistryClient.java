package com.deepansh.inbox.tool;

import com.deepansh.inbox.model.Connection;
import com.deepansh.inbox.model.ExecutionResult;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.ToolDescriptor;
import com.deepansh.inbox.model.ToolInvocation;

import java.util.List;

/**
 * Gateway to the external tool catalog, scoped by a {@link Session}.
 * Each operation is a single round-trip.
 */
public interface ToolRegistryClient {

    /**
     * @return matching tools, empty when nothing matches (never an error)
     * @throws com.deepansh.inbox.exception.ToolExecutionException when the catalog cannot be reached
     */
    List<ToolDescriptor> searchTools(Session session, String intent);

    /**
     * Idempotent: an app that is already authorized comes back AUTHORIZED
     * without prompting the user again.
     *
     * @throws com.deepansh.inbox.exception.ToolExecutionException when the catalog cannot be reached
     */
    Connection requestConnection(Session session, String app);

    /**
     * Runs a batch. One element failing never affects the others, and the
     * result list always has one entry per invocation, in order.
     */
    List<ExecutionResult> executeTools(Session session, List<ToolInvocation> invocations);
}
