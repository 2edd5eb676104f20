package com.deepansh.inbox.llm;

import com.deepansh.inbox.model.LlmResponse;
import com.deepansh.inbox.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation so far and the callable functions to the engine.
     *
     * @param messages  system prompt, instruction, then the assistant/tool pairs of earlier turns
     * @param functions function schemas the engine may choose from
     * @return either a plain text answer or a single function call
     */
    LlmResponse chat(List<Message> messages, List<FunctionDefinition> functions);
}
