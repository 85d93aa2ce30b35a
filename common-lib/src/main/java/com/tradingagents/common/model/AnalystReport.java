package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured text summary produced by one analyst for one domain.
 *
 * <p>{@code degraded} is set when the report was produced without the data it expected:
 * every tool call failed, no tools were enabled, or synthesis itself failed and the
 * report is a placeholder. {@code degradedMarkers} lists what went missing.
 */
public record AnalystReport(
    @JsonProperty("kind")            AnalystKind kind,
    @JsonProperty("text")            String text,
    @JsonProperty("degraded")        boolean degraded,
    @JsonProperty("degradedMarkers") List<String> degradedMarkers,
    @JsonProperty("toolCalls")       int toolCalls
) {
    public static final String UNAVAILABLE_PREFIX = "[ANALYSIS UNAVAILABLE]";

    public AnalystReport {
        degradedMarkers = degradedMarkers == null ? List.of() : List.copyOf(degradedMarkers);
    }

    /** Placeholder used when an analyst failed synthesis entirely. */
    public static AnalystReport unavailable(AnalystKind kind, String reason) {
        return new AnalystReport(kind,
            UNAVAILABLE_PREFIX + " " + kind.displayName() + " analysis unavailable: " + reason,
            true, List.of("synthesis failed: " + reason), 0);
    }
}
