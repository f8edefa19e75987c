package com.memorygraph.store;

import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryNodeRepository implements NodeRepository {

    private final Map<String, MemoryNode> nodes = new ConcurrentHashMap<>();
    private final Map<String, AccessGrant> grants = new ConcurrentHashMap<>();
    private final Map<String, MemoryEdge> edges = new ConcurrentHashMap<>();

    @Override
    public void saveNode(MemoryNode node) { nodes.put(node.id(), node); }

    @Override
    public void deleteNode(String nodeId) { nodes.remove(nodeId); }

    @Override
    public List<MemoryNode> loadNodes() { return List.copyOf(nodes.values()); }

    @Override
    public void saveGrant(AccessGrant grant) { grants.put(grant.id(), grant); }

    @Override
    public void deleteGrant(String grantId) { grants.remove(grantId); }

    @Override
    public List<AccessGrant> loadGrants() { return List.copyOf(grants.values()); }

    @Override
    public void saveEdge(MemoryEdge edge) { edges.put(edge.id(), edge); }

    @Override
    public void deleteEdge(String edgeId) { edges.remove(edgeId); }

    @Override
    public List<MemoryEdge> loadEdges() { return List.copyOf(edges.values()); }
}
