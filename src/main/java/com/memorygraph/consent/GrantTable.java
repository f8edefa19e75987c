package com.memorygraph.consent;

import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.store.NodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Grants keyed by node. Each node's grant list has its own read/write lock: evaluation
 * takes the read lock, issuing or revoking takes the write lock of that node only.
 */
public class GrantTable {

    private static final Logger log = LoggerFactory.getLogger(GrantTable.class);

    private static final class NodeGrants {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        final List<AccessGrant> grants = new ArrayList<>();
    }

    private final NodeRepository repository;
    private final ConcurrentHashMap<String, NodeGrants> byNode = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> nodeOfGrant = new ConcurrentHashMap<>();

    public GrantTable(NodeRepository repository) {
        this.repository = repository;
        for (var grant : repository.loadGrants()) {
            index(grant);
        }
    }

    public void add(AccessGrant grant) {
        repository.saveGrant(grant);
        index(grant);
    }

    private void index(AccessGrant grant) {
        var entry = byNode.computeIfAbsent(grant.nodeId(), k -> new NodeGrants());
        entry.lock.writeLock().lock();
        try {
            entry.grants.add(grant);
        } finally {
            entry.lock.writeLock().unlock();
        }
        nodeOfGrant.put(grant.id(), grant.nodeId());
    }

    public Optional<AccessGrant> find(String grantId) {
        var nodeId = nodeOfGrant.get(grantId);
        if (nodeId == null) return Optional.empty();
        return forNode(nodeId).stream().filter(g -> g.id().equals(grantId)).findFirst();
    }

    /** Copy of the node's grants, expired ones included. */
    public List<AccessGrant> forNode(String nodeId) {
        var entry = byNode.get(nodeId);
        if (entry == null) return List.of();
        entry.lock.readLock().lock();
        try {
            return List.copyOf(entry.grants);
        } finally {
            entry.lock.readLock().unlock();
        }
    }

    /** True when an unexpired grant from {@code grantingOwner} to {@code receivingOwner} exists. */
    public boolean hasActive(String nodeId, String grantingOwner, String receivingOwner,
                             boolean requireModify, Instant now) {
        var entry = byNode.get(nodeId);
        if (entry == null) return false;
        entry.lock.readLock().lock();
        try {
            for (var g : entry.grants) {
                if (g.grantingOwner().equals(grantingOwner)
                        && g.receivingOwner().equals(receivingOwner)
                        && !g.isExpired(now)
                        && (!requireModify || g.canModify())) {
                    return true;
                }
            }
            return false;
        } finally {
            entry.lock.readLock().unlock();
        }
    }

    public boolean remove(String grantId) {
        var nodeId = nodeOfGrant.get(grantId);
        if (nodeId == null) return false;
        var entry = byNode.get(nodeId);
        if (entry == null) return false;
        repository.deleteGrant(grantId);
        entry.lock.writeLock().lock();
        try {
            entry.grants.removeIf(g -> g.id().equals(grantId));
        } finally {
            entry.lock.writeLock().unlock();
        }
        nodeOfGrant.remove(grantId);
        return true;
    }

    /** Drops every grant referencing a node that no longer exists. */
    public void removeNode(String nodeId) {
        for (var grant : forNode(nodeId)) {
            remove(grant.id());
        }
        byNode.remove(nodeId);
    }

    /** Eagerly drops expired grants; evaluation already ignores them. */
    public int purgeExpired(Instant now) {
        int purged = 0;
        for (var nodeId : List.copyOf(byNode.keySet())) {
            for (var grant : forNode(nodeId)) {
                if (grant.isExpired(now) && remove(grant.id())) purged++;
            }
        }
        if (purged > 0) log.info("Purged {} expired grant(s)", purged);
        return purged;
    }

    /** Ids of nodes that have at least one grant on record. */
    public Set<String> nodeIds() {
        return Set.copyOf(byNode.keySet());
    }

    public int size() {
        return nodeOfGrant.size();
    }
}
