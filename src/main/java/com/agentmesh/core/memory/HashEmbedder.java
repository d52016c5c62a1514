package com.agentmesh.core.memory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Deterministic bag-of-words pseudo-embedding. Each lower-cased token is hashed into a bucket
 * with a hash-derived sign; the result is scaled to unit length. Shared words give positive
 * cosine similarity, which is all retrieval needs to rank sensibly.
 */
public class HashEmbedder implements Embedder {

    public static final int DEFAULT_DIMENSION = 128;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimension;

    public HashEmbedder() {
        this(DEFAULT_DIMENSION);
    }

    public HashEmbedder(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        var vector = new float[dimension];
        if (text == null) {
            return vector;
        }
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) continue;
            long hash = crc(token);
            int bucket = (int) (hash % dimension);
            vector[bucket] += ((hash >>> 16) & 1) == 0 ? 1.0f : -1.0f;
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private static long crc(String token) {
        var crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    static void normalize(float[] vector) {
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
