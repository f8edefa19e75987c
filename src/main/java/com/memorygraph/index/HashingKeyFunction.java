package com.memorygraph.index;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Local key function: hashes lower-cased word tokens into a fixed number of buckets and
 * L2-normalises the counts. Deterministic and network free.
 */
public class HashingKeyFunction implements SimilarityKeyFunction {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    public HashingKeyFunction(int dimensions) {
        if (dimensions < 2) throw new IllegalArgumentException("dimensions must be >= 2");
        this.dimensions = dimensions;
    }

    @Override
    public float[] keyFor(String content) {
        var vec = new float[dimensions];
        if (content != null) {
            for (var token : TOKEN_SPLIT.split(content.toLowerCase(Locale.ROOT))) {
                if (token.isEmpty()) continue;
                vec[Math.floorMod(mix(token.hashCode()), dimensions)] += 1f;
            }
        }
        double norm = 0;
        for (var v : vec) norm += v * v;
        if (norm == 0) {
            // cosine similarity is undefined for the zero vector
            vec[0] = 1f;
            return vec;
        }
        var inv = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vec.length; i++) vec[i] *= inv;
        return vec;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    // murmur3 finalizer
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
