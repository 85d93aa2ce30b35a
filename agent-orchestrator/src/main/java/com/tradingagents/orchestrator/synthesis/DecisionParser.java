package com.tradingagents.orchestrator.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.common.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a verdict from free model text.
 *
 * <p>Order of precedence: a JSON object with a {@code verdict} field, then the
 * {@code FINAL TRANSACTION PROPOSAL: **X**} marker, then HOLD.
 */
@Component
public class DecisionParser {

    private static final Logger log = LoggerFactory.getLogger(DecisionParser.class);

    static final Pattern PROPOSAL_MARKER = Pattern.compile(
        "FINAL TRANSACTION PROPOSAL:\\s*\\**\\s*(BUY|SELL|HOLD)", Pattern.CASE_INSENSITIVE);

    public enum Source { JSON, MARKER, DEFAULT }

    public record ParsedDecision(Verdict verdict, double confidence, String rationale, Source source) {}

    private final ObjectMapper objectMapper;

    public DecisionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedDecision parse(String text) {
        String cleaned = text
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            try {
                JsonNode json = objectMapper.readTree(cleaned.substring(start, end + 1));
                if (json.hasNonNull("verdict")) {
                    return new ParsedDecision(
                        Verdict.parse(json.path("verdict").asText()),
                        json.path("confidence").asDouble(0.5),
                        json.path("rationale").asText(cleaned),
                        Source.JSON);
                }
            } catch (JsonProcessingException e) {
                log.debug("[DecisionParser] Embedded JSON unreadable, trying proposal marker. reason={}",
                    e.getOriginalMessage());
            }
        }

        Matcher marker = PROPOSAL_MARKER.matcher(cleaned);
        if (marker.find()) {
            return new ParsedDecision(Verdict.parse(marker.group(1)), 0.5, cleaned, Source.MARKER);
        }
        return new ParsedDecision(Verdict.HOLD, 0.0, cleaned, Source.DEFAULT);
    }
}
