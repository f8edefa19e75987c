package com.memorygraph.shared.config;

import com.memorygraph.shared.model.MemoryLevel;

import java.time.Duration;

/**
 * Default time-to-live per hierarchy level, used when a node is created without an override.
 */
public record TtlConfig(
    Duration atomic,
    Duration daily,
    Duration weekly,
    Duration monthly
) {
    public static TtlConfig defaults() {
        return new TtlConfig(
            Duration.ofDays(1),
            Duration.ofDays(7),
            Duration.ofDays(30),
            Duration.ofDays(365)
        );
    }

    public Duration forLevel(MemoryLevel level) {
        return switch (level) {
            case ATOMIC -> atomic;
            case DAILY -> daily;
            case WEEKLY -> weekly;
            case MONTHLY -> monthly;
        };
    }
}
