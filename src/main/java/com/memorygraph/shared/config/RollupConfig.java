package com.memorygraph.shared.config;

import com.memorygraph.shared.model.MemoryLevel;

import java.time.Duration;

/**
 * Rollup thresholds: how many un-rolled nodes at a level trigger a summary one level up.
 */
public record RollupConfig(
    int atomicToDaily,
    int dailyToWeekly,
    int weeklyToMonthly,
    Duration summarizerTimeout,
    int maxSummaryChars
) {
    public static RollupConfig defaults() {
        return new RollupConfig(100, 7, 4, Duration.ofSeconds(30), 480);
    }

    /** Threshold for rolling up nodes at {@code level}; 0 when the level has nothing above it. */
    public int thresholdFor(MemoryLevel level) {
        return switch (level) {
            case ATOMIC -> atomicToDaily;
            case DAILY -> dailyToWeekly;
            case WEEKLY -> weeklyToMonthly;
            case MONTHLY -> 0;
        };
    }

    public RollupConfig withThresholds(int atomicToDaily, int dailyToWeekly, int weeklyToMonthly) {
        return new RollupConfig(atomicToDaily, dailyToWeekly, weeklyToMonthly, summarizerTimeout, maxSummaryChars);
    }

    public RollupConfig withSummarizerTimeout(Duration timeout) {
        return new RollupConfig(atomicToDaily, dailyToWeekly, weeklyToMonthly, timeout, maxSummaryChars);
    }
}
