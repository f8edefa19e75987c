package com.memorygraph.graph;

import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;

/** Nodes in breadth-first order from the centre; edges whose ends are both in {@code nodes}. */
public record Subgraph(String centerId, int depth, List<MemoryNode> nodes, List<MemoryEdge> edges) {
    public Subgraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
