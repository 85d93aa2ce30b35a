package com.tradingagents.common.llm;

import java.util.List;

/**
 * Model output: free text plus zero or more tool-call requests.
 */
public record ModelReply(String text, List<ToolCall> toolCalls) {

    public ModelReply {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelReply text(String text) {
        return new ModelReply(text, List.of());
    }

    public static ModelReply toolCalls(List<ToolCall> calls) {
        return new ModelReply("", calls);
    }

    public boolean requestsTools() {
        return !toolCalls.isEmpty();
    }
}
