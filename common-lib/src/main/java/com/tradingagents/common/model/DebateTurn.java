package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One argument in a debate. Round index is 1-based.
 * {@code degraded} marks a placeholder recorded when the role produced no argument.
 */
public record DebateTurn(
    @JsonProperty("role")      DebateRole role,
    @JsonProperty("round")     int round,
    @JsonProperty("text")      String text,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("degraded")  boolean degraded
) {
    public static final String NO_ARGUMENT_PREFIX = "[no argument produced]";

    public static DebateTurn of(DebateRole role, int round, String text, Instant timestamp) {
        return new DebateTurn(role, round, text, timestamp, false);
    }

    public static DebateTurn placeholder(DebateRole role, int round, String reason, Instant timestamp) {
        return new DebateTurn(role, round, NO_ARGUMENT_PREFIX + " " + reason, timestamp, true);
    }
}
