package com.memorygraph.graph;

import com.memorygraph.shared.model.MemoryLevel;

import java.util.Map;

public record GraphStats(
    int totalNodes,
    Map<MemoryLevel, Integer> nodesByLevel,
    Map<String, Integer> nodesByOwner,
    int grants,
    int edges,
    double averageAccessCount
) {
    public GraphStats {
        nodesByLevel = Map.copyOf(nodesByLevel);
        nodesByOwner = Map.copyOf(nodesByOwner);
    }
}
