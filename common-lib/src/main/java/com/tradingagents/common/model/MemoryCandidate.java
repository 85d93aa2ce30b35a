package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.memory.MemoryScope;

/**
 * A situation/rationale pair written by a decision stage, waiting for a realized outcome
 * before it becomes a reflection in the matching memory store.
 */
public record MemoryCandidate(
    @JsonProperty("scope")     MemoryScope scope,
    @JsonProperty("situation") String situation,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("verdict")   Verdict verdict
) {}
