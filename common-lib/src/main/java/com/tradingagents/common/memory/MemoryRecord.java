package com.tradingagents.common.memory;

import java.util.Arrays;
import java.util.Objects;

/**
 * A past situation linked to the reflection written once its outcome was known.
 * Immutable: the embedding is copied on the way in and on the way out.
 */
public final class MemoryRecord {

    private final String situation;
    private final double[] embedding;
    private final String reflection;
    private final String outcome;

    public MemoryRecord(String situation, double[] embedding, String reflection, String outcome) {
        this.situation  = situation;
        this.embedding  = embedding == null ? new double[0] : embedding.clone();
        this.reflection = reflection;
        this.outcome    = outcome;
    }

    public String situation() { return situation; }

    public double[] embedding() { return embedding.clone(); }

    public String reflection() { return reflection; }

    public String outcome() { return outcome; }

    double similarityTo(double[] query) {
        return CosineSimilarity.of(embedding, query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryRecord other)) return false;
        return Objects.equals(situation, other.situation)
            && Arrays.equals(embedding, other.embedding)
            && Objects.equals(reflection, other.reflection)
            && Objects.equals(outcome, other.outcome);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(situation, reflection, outcome) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "MemoryRecord[outcome=" + outcome + ", situation=" + abbreviate(situation) + "]";
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 60 ? s : s.substring(0, 57) + "...";
    }
}
