package com.deepansh.inbox.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Non-null when the engine answered in plain text */
    private String content;

    /** Non-null when the engine chose a function */
    private ToolCall toolCall;

    private boolean toolCallRequired;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
