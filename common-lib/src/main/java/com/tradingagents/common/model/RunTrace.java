package com.tradingagents.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Immutable, auditable snapshot of a run's state. Two runs with identical inputs and
 * identical collaborator responses produce equal traces.
 */
public record RunTrace(
    @JsonProperty("symbol")           String symbol,
    @JsonProperty("tradeDate")        LocalDate tradeDate,
    @JsonProperty("stage")            PipelineStage stage,
    @JsonProperty("analystReports")   Map<AnalystKind, AnalystReport> analystReports,
    @JsonProperty("researchDebate")   List<DebateTurn> researchDebate,
    @JsonProperty("researchDecision") Decision researchDecision,
    @JsonProperty("traderDecision")   Decision traderDecision,
    @JsonProperty("riskDebate")       List<DebateTurn> riskDebate,
    @JsonProperty("finalDecision")    Decision finalDecision,
    @JsonProperty("memoryCandidates") List<MemoryCandidate> memoryCandidates,
    @JsonProperty("failure")          String failure
) {}
