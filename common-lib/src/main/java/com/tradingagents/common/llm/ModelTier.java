package com.tradingagents.common.llm;

/**
 * Reasoning depth requested by a caller. Analysts and debaters use the quick tier;
 * the decision stages use the deep tier.
 */
public enum ModelTier {
    QUICK,
    DEEP
}
