package com.memorygraph.graph;

import com.memorygraph.consent.ConsentEngine;
import com.memorygraph.consent.GrantTable;
import com.memorygraph.hierarchy.HierarchyAggregator;
import com.memorygraph.index.SearchHit;
import com.memorygraph.index.SearchQuery;
import com.memorygraph.index.SimilarityIndex;
import com.memorygraph.index.SimilarityKeyFunction;
import com.memorygraph.observability.GraphMetrics;
import com.memorygraph.shared.CancellationSignal;
import com.memorygraph.shared.StorageUnavailableException;
import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;
import com.memorygraph.shared.model.NewMemory;
import com.memorygraph.shared.model.Outcome;
import com.memorygraph.shared.model.SearchResult;
import com.memorygraph.store.NodeStore;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The only entry point to the graph. Consent is enforced here and nowhere else: the store
 * and the index hand back raw nodes and ids, and every result passes
 * {@link ConsentEngine#canRead} before it leaves this class.
 *
 * <p>Search does not pad short results: hits the requester may not read are dropped, and
 * a node that is missing and one that is unreadable look the same to the caller.
 * {@link #readMemory} on the other hand reports {@code NOT_FOUND} and {@code FORBIDDEN}
 * separately.
 */
public class MemoryGraph implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryGraph.class);

    private final NodeStore store;
    private final GrantTable grants;
    private final ConsentEngine consent;
    private final SimilarityIndex index;
    private final SimilarityKeyFunction keyFunction;
    private final HierarchyAggregator aggregator;
    private final GraphMetrics metrics;
    private final Clock clock;
    // committed summaries whose index write failed; retried by the next maintenance pass
    private final Set<String> unindexed = ConcurrentHashMap.newKeySet();

    public MemoryGraph(NodeStore store, GrantTable grants, ConsentEngine consent, SimilarityIndex index,
                       SimilarityKeyFunction keyFunction, HierarchyAggregator aggregator,
                       GraphMetrics metrics, Clock clock) {
        this.store = store;
        this.grants = grants;
        this.consent = consent;
        this.index = index;
        this.keyFunction = keyFunction;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.clock = clock;

        store.onRemoval(node -> {
            index.remove(node.id());
            grants.removeNode(node.id());
        });
        reconcile();
    }

    /** Brings the index and the grant table in line with the nodes that survived a restart. */
    private void reconcile() {
        var live = store.snapshot();
        var liveIds = new HashSet<String>();
        var indexed = index.indexedIds();
        int added = 0;
        for (var node : live) {
            liveIds.add(node.id());
            if (indexed.contains(node.id())) continue;
            try {
                index.index(node);
                added++;
            } catch (IllegalArgumentException e) {
                // e.g. the configured dimensions changed since the key was computed
                log.warn("Node {} cannot be indexed: {}", node.id(), e.getMessage());
            }
        }
        int removed = 0;
        for (var id : indexed) {
            if (!liveIds.contains(id)) {
                index.remove(id);
                removed++;
            }
        }
        int orphanGrants = 0;
        for (var nodeId : grants.nodeIds()) {
            if (!liveIds.contains(nodeId)) {
                orphanGrants += grants.forNode(nodeId).size();
                grants.removeNode(nodeId);
            }
        }
        log.info("Memory graph ready: {} node(s), {} grant(s); index +{} -{}; dropped {} orphan grant(s)",
                live.size(), grants.size(), added, removed, orphanGrants);
    }

    // --- Nodes ---

    public Outcome<MemoryNode> createMemory(String owner, String content, ConsentLevel level) {
        return createMemory(NewMemory.of(owner, content, level));
    }

    public Outcome<MemoryNode> createMemory(NewMemory request) {
        if (request.content() == null) return Outcome.invalid("content must not be null");
        var created = store.prepare(request, keyFunction.keyFor(request.content()));
        if (!created.isOk()) {
            log.debug("Create rejected for owner {}: {}", request.owner(), created.message());
            return created;
        }
        // indexed first: the node becomes readable only once both writes succeeded
        index.index(created.value());
        try {
            store.commit(created.value());
        } catch (RuntimeException e) {
            try {
                index.remove(created.value().id());
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        metrics.nodesCreated().increment();
        return created;
    }

    public Outcome<MemoryNode> readMemory(String nodeId, String requester) {
        var found = store.get(nodeId);
        if (!found.isOk()) {
            metrics.reads("not_found").increment();
            return found;
        }
        if (!consent.canRead(found.value(), requester)) {
            metrics.reads("forbidden").increment();
            log.debug("Read of {} by {} denied", nodeId, requester);
            return Outcome.forbidden("Not permitted to read node " + nodeId);
        }
        metrics.reads("ok").increment();
        return store.touch(nodeId)
                .map(Outcome::ok)
                .orElseGet(() -> Outcome.notFound("No such node: " + nodeId));
    }

    public Outcome<MemoryNode> updateConsent(String nodeId, String requester, ConsentLevel level) {
        return store.updateConsent(nodeId, requester, level, consent::canModify);
    }

    public Outcome<MemoryNode> updateImportance(String nodeId, String requester, double importance) {
        var updated = store.updateImportance(nodeId, requester, importance);
        if (updated.isOk()) {
            // the index keeps importance for ranking ties
            index.index(updated.value());
        }
        return updated;
    }

    public Outcome<MemoryNode> updateTtl(String nodeId, String requester, Duration ttl) {
        return store.updateTtl(nodeId, requester, ttl);
    }

    /** Owner only. Removes the index entry, grants and edges along with the node. */
    public Outcome<Void> deleteMemory(String nodeId, String requester) {
        var deleted = store.delete(nodeId, requester);
        if (deleted.isOk()) unindexed.remove(nodeId);
        return deleted;
    }

    /**
     * Nodes owned by {@code office}, followed by other owners' nodes it may read when
     * {@code includeShared} is set. Both parts oldest first. Access counts are not touched.
     */
    public List<MemoryNode> officeMemories(String office, boolean includeShared) {
        var result = new ArrayList<>(store.ownedBy(office));
        if (includeShared) {
            for (var node : store.snapshot()) {
                if (!node.owner().equals(office) && consent.canRead(node, office)) {
                    result.add(node);
                }
            }
        }
        return List.copyOf(result);
    }

    // --- Search ---

    public Outcome<List<SearchResult>> searchMemories(String text, String requester, int k, double minScore) {
        if (text == null) return Outcome.invalid("query text must not be null");
        return searchMemories(keyFunction.keyFor(text), requester, k, minScore, Set.of(), CancellationSignal.none());
    }

    public Outcome<List<SearchResult>> searchMemories(float[] key, String requester, int k, double minScore) {
        return searchMemories(key, requester, k, minScore, Set.of(), CancellationSignal.none());
    }

    /**
     * @param tags when non-empty, only nodes carrying one of these tags are considered
     * @throws java.util.concurrent.CancellationException when {@code signal} fires mid-search
     */
    public Outcome<List<SearchResult>> searchMemories(float[] key, String requester, int k, double minScore,
                                                      Set<String> tags, CancellationSignal signal) {
        if (key == null) return Outcome.invalid("query key must not be null");
        if (k <= 0) return Outcome.invalid("k must be positive: " + k);
        if (!(minScore >= 0.0 && minScore <= 1.0)) {
            return Outcome.invalid("min score must be within [0, 1]: " + minScore);
        }

        var sample = Timer.start(metrics.registry());
        try {
            List<SearchHit> hits;
            try {
                hits = index.search(new SearchQuery(key, k, minScore, tags), signal);
            } catch (IllegalArgumentException e) {
                return Outcome.invalid(e.getMessage());
            }
            var results = new ArrayList<SearchResult>(hits.size());
            for (var hit : hits) {
                signal.throwIfCancelled("search");
                var found = store.get(hit.nodeId());
                if (!found.isOk() || !consent.canRead(found.value(), requester)) continue;
                store.touch(hit.nodeId()).ifPresent(node -> results.add(new SearchResult(node, hit.score())));
            }
            return Outcome.ok(List.copyOf(results));
        } finally {
            sample.stop(metrics.searchLatency());
        }
    }

    // --- Grants ---

    public Outcome<AccessGrant> grantAccess(String nodeId, String grantingOwner, String receivingOwner,
                                            Duration ttl, boolean canModify) {
        var found = store.get(nodeId);
        if (!found.isOk()) return found.failure();
        return consent.grant(found.value(), grantingOwner, receivingOwner, ttl, canModify);
    }

    public Outcome<Void> revokeAccess(String grantId, String requester) {
        var grant = grants.find(grantId);
        if (grant.isEmpty()) return Outcome.notFound("No such grant: " + grantId);
        if (!store.exists(grant.get().nodeId())) {
            return Outcome.notFound("No such node: " + grant.get().nodeId());
        }
        return consent.revoke(grantId, requester);
    }

    // --- Edges and hierarchy ---

    /**
     * Adds a directed edge. The requester must be able to read both ends and modify at
     * least one of them.
     */
    public Outcome<MemoryEdge> linkMemories(String sourceId, String targetId, String relation,
                                            double weight, String requester) {
        if (relation == null || relation.isBlank()) return Outcome.invalid("relation must not be empty");
        if (!Double.isFinite(weight)) return Outcome.invalid("weight must be finite: " + weight);
        var source = store.get(sourceId);
        if (!source.isOk()) return source.failure();
        var target = store.get(targetId);
        if (!target.isOk()) return target.failure();
        if (!consent.canRead(source.value(), requester) || !consent.canRead(target.value(), requester)) {
            return Outcome.forbidden("Not permitted to read both ends of the edge");
        }
        if (!consent.canModify(source.value(), requester) && !consent.canModify(target.value(), requester)) {
            return Outcome.forbidden("Not permitted to modify either end of the edge");
        }
        return Outcome.ok(store.link(sourceId, targetId, relation, weight, requester));
    }

    /** Readable targets of the node's outgoing edges, optionally limited to one relation. */
    public Outcome<List<MemoryNode>> neighbors(String nodeId, String requester, String relation) {
        var found = store.get(nodeId);
        if (!found.isOk()) return found.failure();
        if (!consent.canRead(found.value(), requester)) {
            return Outcome.forbidden("Not permitted to read node " + nodeId);
        }
        var result = new ArrayList<MemoryNode>();
        for (var edge : store.outgoing(nodeId, relation)) {
            var target = store.get(edge.target());
            if (target.isOk() && consent.canRead(target.value(), requester)) {
                result.add(target.value());
            }
        }
        return Outcome.ok(List.copyOf(result));
    }

    /** Readable, still existing children of a summary, oldest first. */
    public Outcome<List<MemoryNode>> childrenOf(String summaryId, String requester) {
        var found = store.get(summaryId);
        if (!found.isOk()) return found.failure();
        if (!consent.canRead(found.value(), requester)) {
            return Outcome.forbidden("Not permitted to read node " + summaryId);
        }
        var result = new ArrayList<MemoryNode>();
        for (var childId : found.value().children()) {
            var child = store.get(childId);
            if (child.isOk() && consent.canRead(child.value(), requester)) {
                result.add(child.value());
            }
        }
        return Outcome.ok(List.copyOf(result));
    }

    /**
     * Readable nodes reachable from {@code centerId} over outgoing edges within {@code depth}
     * hops. A node the requester may not read is left out and not expanded.
     */
    public Outcome<Subgraph> subgraph(String centerId, String requester, int depth) {
        if (depth < 0) return Outcome.invalid("depth must not be negative: " + depth);
        var center = store.get(centerId);
        if (!center.isOk()) return center.failure();
        if (!consent.canRead(center.value(), requester)) {
            return Outcome.forbidden("Not permitted to read node " + centerId);
        }

        Map<String, MemoryNode> visited = new LinkedHashMap<>();
        visited.put(centerId, center.value());
        var frontier = new ArrayDeque<String>();
        frontier.add(centerId);
        var candidateEdges = new ArrayList<MemoryEdge>();
        for (int hop = 0; hop < depth && !frontier.isEmpty(); hop++) {
            var next = new ArrayDeque<String>();
            for (var id : frontier) {
                for (var edge : store.outgoing(id, null)) {
                    candidateEdges.add(edge);
                    if (visited.containsKey(edge.target())) continue;
                    var target = store.get(edge.target());
                    if (target.isOk() && consent.canRead(target.value(), requester)) {
                        visited.put(edge.target(), target.value());
                        next.add(edge.target());
                    }
                }
            }
            frontier = next;
        }

        var edges = new ArrayList<MemoryEdge>();
        for (var edge : candidateEdges) {
            if (visited.containsKey(edge.source()) && visited.containsKey(edge.target())) edges.add(edge);
        }
        return Outcome.ok(new Subgraph(centerId, depth, new ArrayList<>(visited.values()), edges));
    }

    // --- Maintenance ---

    public MaintenanceReport triggerMaintenance() {
        return triggerMaintenance(CancellationSignal.none());
    }

    /**
     * Evicts expired nodes, purges expired grants, rolls up every {@code (owner, level)}
     * pair whose trigger holds and flushes bookkeeping fields. Safe to call concurrently and
     * on any schedule.
     */
    public MaintenanceReport triggerMaintenance(CancellationSignal signal) {
        int expired = store.deleteExpired();
        metrics.nodesExpired().increment(expired);
        int purged = grants.purgeExpired(clock.instant());

        var pass = aggregator.maintain(signal);
        var summaryIds = new ArrayList<String>();
        for (var summary : pass.summaries()) {
            summaryIds.add(summary.id());
            unindexed.add(summary.id());
        }
        metrics.rollups().increment(summaryIds.size());
        metrics.maintenanceTimeouts().increment(pass.timeouts());
        var indexFailure = indexPendingSummaries();

        int flushed = store.flush();
        if (indexFailure != null) throw indexFailure;
        log.info("Maintenance: {} expired, {} grant(s) purged, {} summary node(s), {} warning(s){}",
                expired, purged, summaryIds.size(), pass.warnings().size(), pass.cancelled() ? ", cancelled" : "");
        return new MaintenanceReport(expired, purged, summaryIds, pass.warnings(), flushed, pass.cancelled());
    }

    /**
     * Indexes every pending summary, including those left over from an earlier pass. Keeps
     * going past a failure so one bad write does not hide the rest; returns the first failure
     * with later ones suppressed, or null.
     */
    private StorageUnavailableException indexPendingSummaries() {
        StorageUnavailableException failure = null;
        for (var id : List.copyOf(unindexed)) {
            var summary = store.get(id);
            if (!summary.isOk()) {
                unindexed.remove(id);
                continue;
            }
            try {
                index.index(summary.value());
                unindexed.remove(id);
            } catch (StorageUnavailableException e) {
                log.warn("Summary {} not indexed, will retry: {}", id, e.getMessage());
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        return failure;
    }

    public GraphStats stats() {
        var nodes = store.snapshot();
        var byLevel = new EnumMap<MemoryLevel, Integer>(MemoryLevel.class);
        for (var level : MemoryLevel.values()) byLevel.put(level, 0);
        var byOwner = new HashMap<String, Integer>();
        long accesses = 0;
        for (var node : nodes) {
            byLevel.merge(node.level(), 1, Integer::sum);
            byOwner.merge(node.owner(), 1, Integer::sum);
            accesses += node.accessCount();
        }
        double average = nodes.isEmpty() ? 0.0 : (double) accesses / nodes.size();
        return new GraphStats(nodes.size(), byLevel, byOwner, grants.size(), store.edgeCount(), average);
    }

    public GraphMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        aggregator.close();
        try {
            store.flush();
        } finally {
            index.close();
        }
    }
}
