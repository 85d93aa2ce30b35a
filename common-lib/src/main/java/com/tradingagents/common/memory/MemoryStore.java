package com.tradingagents.common.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds embedded "situation → reflection → outcome" records and answers top-K similarity
 * queries.
 *
 * <p>Reads work on the copy-on-write snapshot current at call time, so retrievals are
 * concurrent-safe and never observe a half-written record. Retrieval is a pure read.
 * Writes only happen once a run's outcome is known, outside the live decision path.
 */
public class MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryStore.class);

    private final String name;
    private final EmbeddingModel embeddingModel;
    private final CopyOnWriteArrayList<MemoryRecord> records = new CopyOnWriteArrayList<>();

    public MemoryStore(String name, EmbeddingModel embeddingModel) {
        this.name = name;
        this.embeddingModel = embeddingModel;
    }

    public String name() {
        return name;
    }

    /**
     * Returns up to {@code k} records most similar to {@code situation}, highest similarity
     * first. Ties keep insertion order. An empty store (cold start) returns an empty list.
     */
    public List<ScoredMemory> retrieve(String situation, int k) {
        if (k <= 0) return List.of();
        List<MemoryRecord> snapshot = List.copyOf(records);
        if (snapshot.isEmpty()) return List.of();

        double[] query = embeddingModel.embed(situation);
        List<ScoredMemory> scored = new ArrayList<>(snapshot.size());
        for (MemoryRecord r : snapshot) {
            scored.add(new ScoredMemory(r, r.similarityTo(query)));
        }
        scored.sort(Comparator.comparingDouble(ScoredMemory::similarity).reversed());
        List<ScoredMemory> top = List.copyOf(scored.subList(0, Math.min(k, scored.size())));
        log.debug("[MemoryStore] retrieve store={} candidates={} returned={}", name, snapshot.size(), top.size());
        return top;
    }

    /** Embeds and appends a new reflection. */
    public MemoryRecord add(String situation, String reflection, String outcome) {
        MemoryRecord record = new MemoryRecord(situation, embeddingModel.embed(situation), reflection, outcome);
        records.add(record);
        log.info("[MemoryStore] reflection added. store={} outcome={} size={}", name, outcome, records.size());
        return record;
    }

    public int size() {
        return records.size();
    }
}
