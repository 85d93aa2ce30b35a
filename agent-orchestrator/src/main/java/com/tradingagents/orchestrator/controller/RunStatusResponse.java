package com.tradingagents.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.common.model.RunTrace;

public record RunStatusResponse(
    @JsonProperty("runId") String runId,
    @JsonProperty("stage") PipelineStage stage,
    @JsonProperty("trace") RunTrace trace
) {}
