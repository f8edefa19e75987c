package com.memorygraph.shared.model;

import java.util.Optional;

/**
 * Position of a node in the summary hierarchy, finest first.
 */
public enum MemoryLevel {
    ATOMIC,
    DAILY,
    WEEKLY,
    MONTHLY;

    public Optional<MemoryLevel> coarser() {
        return switch (this) {
            case ATOMIC -> Optional.of(DAILY);
            case DAILY -> Optional.of(WEEKLY);
            case WEEKLY -> Optional.of(MONTHLY);
            case MONTHLY -> Optional.empty();
        };
    }

    public boolean canHaveChildren() {
        return this != ATOMIC;
    }

    public boolean canHaveParent() {
        return this != MONTHLY;
    }
}
