package com.tradingagents.common.memory;

/**
 * Turns a situation description into a fixed-length vector.
 * Implementations must be deterministic for a given input.
 */
public interface EmbeddingModel {

    double[] embed(String text);

    int dimensions();
}
