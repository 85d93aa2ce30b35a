package com.tradingagents.orchestrator.controller;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("No run with id " + runId);
    }
}
