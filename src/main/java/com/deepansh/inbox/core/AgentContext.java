package com.deepansh.inbox.core;

import com.deepansh.inbox.model.AgentRunRequest;
import com.deepansh.inbox.model.AgentTurn;
import com.deepansh.inbox.model.Session;
import com.deepansh.inbox.model.ToolDescriptor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Holds all mutable state for a single agent run.
 * Passed through the loop instead of scattered fields on AgentLoop.
 */
@Data
@Builder
public class AgentContext {

    private String runId;
    private Session session;
    private AgentRunRequest request;
    private RunState state;

    /** Append-only, in step order */
    private List<AgentTurn> turns;

    /** Every tool returned by a search in this run, by tool id */
    private Map<String, ToolDescriptor> discoveredTools;

    /** Set once the single RESPONDING transition has happened */
    private boolean responded;

    public int nextStepIndex() {
        return turns.size() + 1;
    }
}
