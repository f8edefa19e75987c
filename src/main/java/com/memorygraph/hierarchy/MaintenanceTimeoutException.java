package com.memorygraph.hierarchy;

import com.memorygraph.shared.model.MemoryLevel;

import java.time.Duration;

public class MaintenanceTimeoutException extends RollupException {

    public MaintenanceTimeoutException(String owner, MemoryLevel level, Duration timeout) {
        super("Summarizer exceeded " + timeout.toMillis() + "ms for owner=" + owner + " level=" + level);
    }
}
