package com.tradingagents.common.llm;

import java.util.List;

/**
 * One conversational message sent to the model.
 *
 * <p>{@code toolCalls} is populated on assistant messages that requested tools;
 * {@code toolCallId} is populated on tool-result messages.
 */
public record ModelMessage(
    Role role,
    String content,
    List<ToolCall> toolCalls,
    String toolCallId,
    boolean toolError
) {
    public enum Role { USER, ASSISTANT, TOOL }

    public ModelMessage {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelMessage user(String content) {
        return new ModelMessage(Role.USER, content, List.of(), null, false);
    }

    public static ModelMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ModelMessage(Role.ASSISTANT, content, toolCalls, null, false);
    }

    public static ModelMessage toolResult(String toolCallId, String content, boolean error) {
        return new ModelMessage(Role.TOOL, content, List.of(), toolCallId, error);
    }
}
