package com.tradingagents.analysis.tool.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.analysis.tool.FailureKind;
import com.tradingagents.analysis.tool.ToolCapability;
import com.tradingagents.analysis.tool.ToolFailureException;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Crypto Fear &amp; Greed index from alternative.me.
 */
public class SentimentCapabilities {

    public static final String FEAR_GREED = "get_crypto_fear_greed_index";

    private final WebClient fearGreedClient;
    private final ObjectMapper objectMapper;

    public SentimentCapabilities(WebClient fearGreedClient, ObjectMapper objectMapper) {
        this.fearGreedClient = fearGreedClient;
        this.objectMapper = objectMapper;
    }

    public List<ToolCapability> capabilities() {
        return List.of(new ToolCapability(FEAR_GREED,
            "Get the Crypto Fear & Greed Index (0 = extreme fear, 100 = extreme greed).",
            List.of(), args -> fearGreed()));
    }

    Mono<String> fearGreed() {
        return fearGreedClient.get()
            .uri("/fng/")
            .retrieve()
            .bodyToMono(String.class)
            .map(body -> format(JsonResponses.read(objectMapper, body, "alternative.me")));
    }

    static String format(JsonNode root) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ToolFailureException(FailureKind.PERMANENT, "fear & greed response had no data");
        }
        int value = data.get(0).path("value").asInt();
        String classification = data.get(0).path("value_classification").asText("Unknown");
        return String.format(Locale.ROOT, """
            === Crypto Fear & Greed Index ===

            Current Value: %d/100
            Classification: %s

            Interpretation: %s
            """, value, classification, interpret(value)).strip();
    }

    static String interpret(int value) {
        if (value < 25) return "Extreme fear; historically a contrarian buying zone.";
        if (value < 45) return "Fear; market participants are cautious.";
        if (value <= 55) return "Neutral sentiment.";
        if (value <= 75) return "Greed; momentum is strong but risk of pullback grows.";
        return "Extreme greed; market may be overheated.";
    }
}
