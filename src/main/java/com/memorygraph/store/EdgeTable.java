package com.memorygraph.store;

import com.memorygraph.shared.model.MemoryEdge;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

class EdgeTable {

    private final ConcurrentHashMap<String, MemoryEdge> edges = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> outgoing = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> incoming = new ConcurrentHashMap<>();

    void add(MemoryEdge edge) {
        edges.put(edge.id(), edge);
        outgoing.computeIfAbsent(edge.source(), k -> ConcurrentHashMap.newKeySet()).add(edge.id());
        incoming.computeIfAbsent(edge.target(), k -> ConcurrentHashMap.newKeySet()).add(edge.id());
    }

    List<MemoryEdge> outgoing(String nodeId, String relation) {
        var ids = outgoing.getOrDefault(nodeId, Set.of());
        var result = new ArrayList<MemoryEdge>();
        for (var id : ids) {
            var edge = edges.get(id);
            if (edge != null && (relation == null || relation.equals(edge.relation()))) {
                result.add(edge);
            }
        }
        return result;
    }

    /** Detaches every edge with {@code nodeId} at either end and returns what was removed. */
    List<MemoryEdge> removeTouching(String nodeId) {
        var ids = new ArrayList<String>();
        var out = outgoing.remove(nodeId);
        if (out != null) ids.addAll(out);
        var in = incoming.remove(nodeId);
        if (in != null) ids.addAll(in);

        var removed = new ArrayList<MemoryEdge>();
        for (var id : ids) {
            var edge = edges.remove(id);
            if (edge == null) continue;
            removed.add(edge);
            var sources = outgoing.get(edge.source());
            if (sources != null) sources.remove(id);
            var targets = incoming.get(edge.target());
            if (targets != null) targets.remove(id);
        }
        return removed;
    }

    int size() {
        return edges.size();
    }
}
