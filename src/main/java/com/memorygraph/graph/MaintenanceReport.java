package com.memorygraph.graph;

import java.util.List;

public record MaintenanceReport(
    int expiredNodes,
    int purgedGrants,
    List<String> summaryIds,
    List<String> warnings,
    int flushedNodes,
    boolean cancelled
) {
    public MaintenanceReport {
        summaryIds = List.copyOf(summaryIds);
        warnings = List.copyOf(warnings);
    }
}
