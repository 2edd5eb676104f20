package com.deepansh.inbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** One chat message exchanged with the reasoning engine. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private String content;

    /** Present when role = tool: links back to the assistant's tool_call id */
    private String toolCallId;

    /**
     * Present when role = assistant and the engine chose an action.
     * Echoed back on the next request so results correlate with their calls.
     */
    private List<ToolCall> toolCalls;
}
