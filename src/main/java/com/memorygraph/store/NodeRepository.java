package com.memorygraph.store;

import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;

/**
 * Durable record storage for nodes, grants and edges. Every method either completes
 * or throws {@link com.memorygraph.shared.StorageUnavailableException}.
 */
public interface NodeRepository {
    void saveNode(MemoryNode node);
    void deleteNode(String nodeId);
    List<MemoryNode> loadNodes();

    void saveGrant(AccessGrant grant);
    void deleteGrant(String grantId);
    List<AccessGrant> loadGrants();

    void saveEdge(MemoryEdge edge);
    void deleteEdge(String edgeId);
    List<MemoryEdge> loadEdges();
}
