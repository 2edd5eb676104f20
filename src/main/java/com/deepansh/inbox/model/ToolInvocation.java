package com.deepansh.inbox.model;

import java.util.Map;

/** One element of an execute batch: which tool, with what input. */
public record ToolInvocation(ToolDescriptor tool, Map<String, Object> input) {
}
