package com.deepansh.inbox.llm;

import com.deepansh.inbox.model.AgentAction;
import com.deepansh.inbox.model.AgentTurn;
import com.deepansh.inbox.model.ConversationEntry;

import java.util.List;

/**
 * The planning oracle: given the instruction and what has happened so far,
 * choose exactly one next action.
 */
public interface ReasoningEngine {

    /**
     * @throws com.deepansh.inbox.exception.UnresolvableActionException when the
     *         engine answers with something that is not a valid action
     * @throws com.deepansh.inbox.exception.ReasoningUnavailableException when the
     *         engine cannot be reached
     */
    AgentAction nextAction(String instruction, List<ConversationEntry> conversation, List<AgentTurn> history);
}
