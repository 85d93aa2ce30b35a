package com.tradingagents.orchestrator.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process index of runs by id, for status queries, cancellation and outcome recording.
 *
 * <p>Holds at most {@code pipeline.retained-runs} runs. When a new run would exceed that,
 * the oldest finished runs are dropped first; runs still in flight are never evicted.
 */
@Component
public class RunRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    private final int maxRetained;
    private final Map<String, TradingState> runs = new LinkedHashMap<>();

    public RunRegistry(@Value("${pipeline.retained-runs:1000}") int maxRetained) {
        if (maxRetained < 1) {
            throw new IllegalArgumentException("pipeline.retained-runs must be >= 1, got " + maxRetained);
        }
        this.maxRetained = maxRetained;
    }

    synchronized void register(TradingState state) {
        runs.put(state.runId(), state);
        evictFinished();
    }

    public synchronized Optional<TradingState> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** Retained runs, oldest first. */
    synchronized List<TradingState> snapshot() {
        return new ArrayList<>(runs.values());
    }

    private void evictFinished() {
        Iterator<TradingState> oldestFirst = runs.values().iterator();
        int evicted = 0;
        while (runs.size() > maxRetained && oldestFirst.hasNext()) {
            TradingState candidate = oldestFirst.next();
            if (candidate.stage().isTerminal()) {
                oldestFirst.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[RunRegistry] Evicted finished runs. count={} retained={}", evicted, runs.size());
        }
        if (runs.size() > maxRetained) {
            log.warn("[RunRegistry] In-flight runs exceed retention. retained={} limit={}", runs.size(), maxRetained);
        }
    }
}
