package com.deepansh.inbox.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** A function call emitted by the reasoning engine. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Assigned by the provider; echoed back in the matching tool message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}
