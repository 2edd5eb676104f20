package com.deepansh.inbox.model;

import java.util.List;
import java.util.Map;

/**
 * The single next step chosen by the reasoning engine.
 *
 * Closed set: the loop switches over {@link #type()}, which the compiler checks
 * for exhaustiveness, and then reads the concrete record.
 */
public sealed interface AgentAction
        permits AgentAction.Search, AgentAction.Authenticate, AgentAction.Execute,
                AgentAction.Respond, AgentAction.Stop {

    ActionType type();

    record Search(String intent) implements AgentAction {
        public ActionType type() { return ActionType.SEARCH; }
    }

    record Authenticate(String app) implements AgentAction {
        public ActionType type() { return ActionType.AUTH; }
    }

    record Execute(List<Call> calls) implements AgentAction {
        public ActionType type() { return ActionType.EXECUTE; }

        /** A tool the planner wants to run, referenced by id from an earlier search. */
        public record Call(String toolId, Map<String, Object> input) {
        }
    }

    record Respond(String message) implements AgentAction {
        public ActionType type() { return ActionType.RESPOND; }
    }

    record Stop(String reason) implements AgentAction {
        public ActionType type() { return ActionType.STOP; }
    }
}
