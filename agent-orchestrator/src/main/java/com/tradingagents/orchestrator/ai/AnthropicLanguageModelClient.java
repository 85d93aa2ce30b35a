package com.tradingagents.orchestrator.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.common.exception.GenerationException;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.llm.ModelMessage;
import com.tradingagents.common.llm.ModelReply;
import com.tradingagents.common.llm.ModelRequest;
import com.tradingagents.common.llm.ToolCall;
import com.tradingagents.common.llm.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LanguageModelClient} backed by the Anthropic Messages API, including tool use.
 *
 * <p>Tool results and follow-up user text are folded into a single {@code user} turn, since
 * the API expects tool results in the user message that follows the {@code tool_use} turn.
 * Without an API key every call fails with {@link GenerationException}; callers degrade
 * through their own fallbacks.
 */
@Service
public class AnthropicLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLanguageModelClient.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String deepModel;
    private final String quickModel;

    public AnthropicLanguageModelClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                                        @Value("${anthropic.api-key:}") String apiKey,
                                        @Value("${anthropic.model:" + ModelSelector.DEFAULT_DEEP_MODEL + "}") String deepModel,
                                        @Value("${anthropic.quick-model:" + ModelSelector.DEFAULT_QUICK_MODEL + "}") String quickModel) {
        this.anthropicClient = builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.deepModel = deepModel;
        this.quickModel = quickModel;
    }

    @Override
    public Mono<ModelReply> generate(ModelRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Anthropic] No API key configured. agent={}", request.agentName());
            return Mono.error(new GenerationException("No Anthropic API key configured"));
        }
        String model = ModelSelector.selectModel(request.tier(), deepModel, quickModel);

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(buildBody(request, model)))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .map(this::parseReply)
            .doOnSuccess(reply -> log.info("[Anthropic] agent={} model={} textChars={} toolCalls={}",
                request.agentName(), model, reply.text().length(), reply.toolCalls().size()))
            .onErrorMap(e -> !(e instanceof GenerationException),
                e -> new GenerationException("Anthropic call failed for " + request.agentName() + ": " + e.getMessage(), e));
    }

    Map<String, Object> buildBody(ModelRequest request, String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.maxTokens());
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            body.put("system", request.systemPrompt());
        }
        body.put("messages", toApiMessages(request.messages()));
        if (!request.tools().isEmpty()) {
            List<Map<String, Object>> tools = new ArrayList<>();
            for (ToolDefinition def : request.tools()) {
                tools.add(Map.of(
                    "name", def.name(),
                    "description", def.description(),
                    "input_schema", def.inputSchema()));
            }
            body.put("tools", tools);
        }
        return body;
    }

    private static List<Map<String, Object>> toApiMessages(List<ModelMessage> messages) {
        List<Map<String, Object>> out = new ArrayList<>();
        String currentRole = null;
        List<Map<String, Object>> blocks = null;

        for (ModelMessage m : messages) {
            String role = m.role() == ModelMessage.Role.ASSISTANT ? "assistant" : "user";
            if (!role.equals(currentRole)) {
                blocks = new ArrayList<>();
                out.add(Map.of("role", role, "content", blocks));
                currentRole = role;
            }
            switch (m.role()) {
                case USER -> blocks.add(Map.of("type", "text", "text", m.content()));
                case ASSISTANT -> {
                    if (m.content() != null && !m.content().isBlank()) {
                        blocks.add(Map.of("type", "text", "text", m.content()));
                    }
                    for (ToolCall call : m.toolCalls()) {
                        blocks.add(Map.of("type", "tool_use", "id", call.id(),
                            "name", call.capability(), "input", call.arguments()));
                    }
                }
                case TOOL -> blocks.add(Map.of("type", "tool_result", "tool_use_id", m.toolCallId(),
                    "content", m.content(), "is_error", m.toolError()));
            }
        }
        return out;
    }

    ModelReply parseReply(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new GenerationException("Failed to read Anthropic response", e);
        }
        JsonNode content = root.path("content");
        if (!content.isArray()) {
            throw new GenerationException("Anthropic response has no content: " + root.path("error").path("message").asText(""));
        }
        StringBuilder text = new StringBuilder();
        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    if (text.length() > 0) text.append('\n');
                    text.append(block.path("text").asText());
                }
                case "tool_use" -> calls.add(new ToolCall(block.path("id").asText(),
                    block.path("name").asText(), toArguments(block.path("input"))));
                default -> log.debug("[Anthropic] Ignoring content block type={}", block.path("type").asText());
            }
        }
        return new ModelReply(text.toString(), calls);
    }

    private Map<String, Object> toArguments(JsonNode input) {
        if (!input.isObject()) return Map.of();
        Map<String, Object> raw = objectMapper.convertValue(input, new TypeReference<Map<String, Object>>() {});
        Map<String, Object> args = new HashMap<>();
        raw.forEach((k, v) -> {
            if (v != null) args.put(k, v);
        });
        return args;
    }
}
