package com.tradingagents.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param outcome realized result of acting on the decision, e.g. "+3.1% after 7 days"
 * @param notes   optional lesson to store verbatim as the reflection
 */
public record OutcomeRequest(
    @JsonProperty("outcome") String outcome,
    @JsonProperty("notes")   String notes
) {}
