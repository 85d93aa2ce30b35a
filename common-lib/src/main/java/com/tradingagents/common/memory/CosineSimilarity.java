package com.tradingagents.common.memory;

/**
 * Cosine similarity between two dense vectors. Mismatched lengths or zero vectors score 0.
 */
final class CosineSimilarity {

    private CosineSimilarity() {}

    static double of(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
