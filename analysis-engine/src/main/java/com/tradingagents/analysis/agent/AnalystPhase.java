package com.tradingagents.analysis.agent;

/**
 * Lifecycle of a single analyst run.
 */
public enum AnalystPhase {
    IDLE,
    AWAITING_TOOL_RESULTS,
    SYNTHESIZING,
    DONE
}
