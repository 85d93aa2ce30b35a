package com.tradingagents.common.model;

/**
 * Stages of one pipeline run, in execution order.
 * {@link #CANCELLED} and {@link #ABORTED} are terminal alternatives to {@link #COMPLETE}.
 */
public enum PipelineStage {
    CREATED,
    COLLECTING_ANALYSTS,
    RESEARCH_DEBATE,
    RESEARCH_DECISION,
    TRADER_DECISION,
    RISK_DEBATE,
    FINAL_DECISION,
    COMPLETE,
    CANCELLED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED || this == ABORTED;
    }
}
