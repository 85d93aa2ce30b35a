package com.tradingagents.common.memory;

/**
 * A retrieved record with its similarity to the query situation.
 */
public record ScoredMemory(MemoryRecord record, double similarity) {}
