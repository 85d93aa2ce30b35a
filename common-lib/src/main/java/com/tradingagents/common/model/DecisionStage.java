package com.tradingagents.common.model;

/** The three synthesizing stages of the pipeline. */
public enum DecisionStage {
    RESEARCH_MANAGER,
    TRADER,
    RISK_MANAGER
}
