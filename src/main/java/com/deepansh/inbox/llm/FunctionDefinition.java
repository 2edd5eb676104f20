package com.deepansh.inbox.llm;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Schema of a function offered to the engine.
 */
@Data
@Builder
public class FunctionDefinition {

    private String name;
    private String description;
    private Map<String, Object> parameters;

    /**
     * OpenAI-compatible shape: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", parameters
                )
        );
    }
}
