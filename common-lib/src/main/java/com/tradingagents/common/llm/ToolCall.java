package com.tradingagents.common.llm;

import java.util.Map;

/**
 * A model's request to run a named capability.
 */
public record ToolCall(String id, String capability, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
