package com.tradingagents.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DecideRequest(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("date")   LocalDate date
) {}
