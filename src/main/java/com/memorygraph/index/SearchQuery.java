package com.memorygraph.index;

import java.util.Set;

/**
 * @param tags when non-empty, only nodes carrying at least one of these tags match
 */
public record SearchQuery(float[] key, int k, double minScore, Set<String> tags) {
    public SearchQuery {
        key = key.clone();
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static SearchQuery of(float[] key, int k, double minScore) {
        return new SearchQuery(key, k, minScore, Set.of());
    }
}
