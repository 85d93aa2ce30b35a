package com.tradingagents.common.llm;

import java.util.List;

/**
 * A single generation request.
 *
 * @param agentName    caller identity, used for logging and by scripted test doubles
 * @param tier         requested reasoning depth
 * @param systemPrompt instructions framing the agent's role
 * @param messages     conversation so far; never empty
 * @param tools        tools the model may request; empty for tool-free generation
 * @param maxTokens    output budget
 */
public record ModelRequest(
    String agentName,
    ModelTier tier,
    String systemPrompt,
    List<ModelMessage> messages,
    List<ToolDefinition> tools,
    int maxTokens
) {
    public ModelRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ModelRequest simple(String agentName, ModelTier tier, String systemPrompt,
                                      String userPrompt, int maxTokens) {
        return new ModelRequest(agentName, tier, systemPrompt,
            List.of(ModelMessage.user(userPrompt)), List.of(), maxTokens);
    }

    /** The last user-authored message, or an empty string. */
    public String lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ModelMessage m = messages.get(i);
            if (m.role() == ModelMessage.Role.USER) return m.content();
        }
        return "";
    }
}
