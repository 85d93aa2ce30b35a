package com.tradingagents.orchestrator.debate;

public enum TranscriptStatus {
    OPEN,
    COMPLETE,
    CANCELLED
}
