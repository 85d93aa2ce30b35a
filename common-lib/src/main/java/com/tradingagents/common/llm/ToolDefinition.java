package com.tradingagents.common.llm;

import java.util.Map;

/**
 * Model-facing description of one capability.
 *
 * @param inputSchema JSON-schema shaped map ({@code type}, {@code properties}, {@code required})
 */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {

    public ToolDefinition {
        inputSchema = inputSchema == null ? Map.of() : Map.copyOf(inputSchema);
    }
}
