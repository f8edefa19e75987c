package com.memorygraph.shared.model;

import java.time.Duration;
import java.util.Set;

/**
 * Creation request for an atomic node. {@code ttl} and {@code importance} may be null,
 * in which case the level default and {@link #DEFAULT_IMPORTANCE} apply.
 */
public record NewMemory(
    String owner,
    String content,
    ConsentLevel consent,
    Duration ttl,
    Double importance,
    Set<String> tags
) {
    public static final double DEFAULT_IMPORTANCE = 0.5;

    public NewMemory {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static NewMemory of(String owner, String content, ConsentLevel consent) {
        return new NewMemory(owner, content, consent, null, null, Set.of());
    }

    public NewMemory withTtl(Duration ttl) {
        return new NewMemory(owner, content, consent, ttl, importance, tags);
    }

    public NewMemory withImportance(double importance) {
        return new NewMemory(owner, content, consent, ttl, importance, tags);
    }

    public NewMemory withTags(Set<String> tags) {
        return new NewMemory(owner, content, consent, ttl, importance, tags);
    }
}
