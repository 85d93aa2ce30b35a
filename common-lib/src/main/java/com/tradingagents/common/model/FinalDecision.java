package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a completed run: the authoritative verdict, its rationale and the full trace.
 */
public record FinalDecision(
    @JsonProperty("runId")     String runId,
    @JsonProperty("verdict")   Verdict verdict,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("trace")     RunTrace trace
) {}
