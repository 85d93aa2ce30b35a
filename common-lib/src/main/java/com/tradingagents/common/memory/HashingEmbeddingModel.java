package com.tradingagents.common.memory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Local bag-of-words embedding using the hashing trick. Tokens are lower-cased
 * alphanumerics; each token adds +1/-1 to one bucket (sign from a second hash bit), and
 * the vector is L2-normalised. Deterministic across JVMs since it relies on CRC32, not
 * {@link String#hashCode()}.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    public static final int DEFAULT_DIMENSIONS = 512;

    private final int dimensions;

    public HashingEmbeddingModel() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingModel(int dimensions) {
        if (dimensions < 8) {
            throw new IllegalArgumentException("dimensions must be >= 8 (was " + dimensions + ")");
        }
        this.dimensions = dimensions;
    }

    @Override
    public double[] embed(String text) {
        double[] vector = new double[dimensions];
        if (text == null || text.isBlank()) return vector;

        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (token.length() < 2) continue;
            long hash = crc(token);
            int bucket = (int) (hash % dimensions);
            double sign = ((hash >>> 31) & 1L) == 0 ? 1.0 : -1.0;
            vector[bucket] += sign;
        }

        double norm = 0;
        for (double v : vector) norm += v * v;
        if (norm > 0) {
            double inv = 1.0 / Math.sqrt(norm);
            for (int i = 0; i < vector.length; i++) vector[i] *= inv;
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private static long crc(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
