package com.tradingagents.common.memory;

/**
 * Which reflection store a record belongs to. Each debate and each decision stage
 * learns from its own history.
 */
public enum MemoryScope {
    RESEARCH_DEBATE,
    RISK_DEBATE,
    RESEARCH_MANAGER,
    TRADER,
    RISK_MANAGER
}
