package com.memorygraph.store;

import com.memorygraph.shared.Deadlines;
import com.memorygraph.shared.config.TtlConfig;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;
import com.memorygraph.shared.model.NewMemory;
import com.memorygraph.shared.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiPredicate;
import java.util.function.Consumer;

/**
 * Owns every memory node. Nodes are immutable records held in a concurrent map and
 * replaced through {@code compute}, which serializes mutations of one node without
 * blocking any other node.
 *
 * <p>No consent checks happen here; {@link #get} is a raw fetch for the graph facade.
 */
public class NodeStore {

    private static final Logger log = LoggerFactory.getLogger(NodeStore.class);

    private final NodeRepository repository;
    private final TtlConfig ttlConfig;
    private final Clock clock;

    private final ConcurrentHashMap<String, MemoryNode> nodes = new ConcurrentHashMap<>();
    // child id -> summary id, rebuilt from the summaries' children on load
    private final ConcurrentHashMap<String, String> parents = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> byOwner = new ConcurrentHashMap<>();
    private final Set<String> dirty = ConcurrentHashMap.newKeySet();
    private final EdgeTable edges = new EdgeTable();
    private final List<Consumer<MemoryNode>> removalListeners = new CopyOnWriteArrayList<>();

    public NodeStore(NodeRepository repository, TtlConfig ttlConfig, Clock clock) {
        this.repository = repository;
        this.ttlConfig = ttlConfig;
        this.clock = clock;
        load();
    }

    public void onRemoval(Consumer<MemoryNode> listener) {
        removalListeners.add(listener);
    }

    // --- Creation ---

    public Outcome<MemoryNode> create(NewMemory request, float[] similarityKey) {
        var prepared = prepare(request, similarityKey);
        if (prepared.isOk()) insert(prepared.value());
        return prepared;
    }

    /** Validates a request and builds the atomic node without storing it; see {@link #commit}. */
    public Outcome<MemoryNode> prepare(NewMemory request, float[] similarityKey) {
        if (request.owner() == null || request.owner().isBlank()) {
            return Outcome.invalid("owner must not be empty");
        }
        if (request.content() == null) {
            return Outcome.invalid("content must not be null");
        }
        if (request.consent() == null) {
            return Outcome.invalid("consent level is required");
        }
        var now = clock.instant();
        var ttl = request.ttl() != null ? request.ttl() : ttlConfig.forLevel(MemoryLevel.ATOMIC);
        var ttlProblem = checkTtl(now, ttl);
        if (ttlProblem != null) return Outcome.invalid(ttlProblem);
        var importance = request.importance() != null ? request.importance() : NewMemory.DEFAULT_IMPORTANCE;
        if (!validImportance(importance)) {
            return Outcome.invalid("importance must be within [0, 1]: " + importance);
        }

        var node = new MemoryNode(
                UUID.randomUUID().toString(), request.owner(), MemoryLevel.ATOMIC, request.content(),
                similarityKey, request.consent(), now, ttl, 0, now, importance,
                request.tags(), List.of(), null);
        return Outcome.ok(node);
    }

    /** Stores a node built by {@link #prepare}. */
    public void commit(MemoryNode prepared) {
        if (prepared.level() != MemoryLevel.ATOMIC || nodes.containsKey(prepared.id())) {
            throw new IllegalArgumentException("Not a freshly prepared node: " + prepared.id());
        }
        insert(prepared);
    }

    /**
     * Commits a summary node together with the parent links of its children. Called by the
     * hierarchy aggregator while it holds the rollup lock for {@code (owner, child level)},
     * so no other writer can parent the same children concurrently.
     */
    public MemoryNode createSummary(String owner, MemoryLevel level, String content, float[] similarityKey,
                                    ConsentLevel consent, double importance, Set<String> tags,
                                    List<String> children) {
        if (!level.canHaveChildren()) {
            throw new IllegalArgumentException("Level " + level + " cannot summarize");
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Summary needs at least one child");
        }
        for (var childId : children) {
            var child = nodes.get(childId);
            if (child != null && !child.level().coarser().equals(Optional.of(level))) {
                throw new IllegalArgumentException("Child " + childId + " is " + child.level() + ", not below " + level);
            }
            var existing = parents.get(childId);
            if (existing != null) {
                throw new IllegalStateException("Child " + childId + " already rolled into " + existing);
            }
        }

        var now = clock.instant();
        var summary = new MemoryNode(
                UUID.randomUUID().toString(), owner, level, content, similarityKey, consent, now,
                ttlConfig.forLevel(level), 0, now, importance, tags, children, null);
        insert(summary);
        for (var childId : children) {
            if (nodes.containsKey(childId)) {
                parents.put(childId, summary.id());
            }
        }
        return summary;
    }

    private void insert(MemoryNode node) {
        repository.saveNode(node);
        nodes.put(node.id(), node);
        byOwner.computeIfAbsent(node.owner(), k -> ConcurrentHashMap.newKeySet()).add(node.id());
    }

    // --- Reads ---

    /**
     * Raw fetch. An expired node is evicted on the spot and reported as not found, so a
     * stale node is never returned even if the background sweep has not run yet.
     */
    public Outcome<MemoryNode> get(String nodeId) {
        if (nodeId == null) return Outcome.notFound("node id is null");
        var node = nodes.get(nodeId);
        if (node == null) return Outcome.notFound("No such node: " + nodeId);
        if (node.isExpired(clock.instant())) {
            evict(nodeId);
            return Outcome.notFound("No such node: " + nodeId);
        }
        return Outcome.ok(view(node));
    }

    public boolean exists(String nodeId) {
        return get(nodeId).isOk();
    }

    public Optional<String> parentOf(String nodeId) {
        return Optional.ofNullable(parents.get(nodeId));
    }

    /** Live nodes of {@code owner} at {@code level} that have not been rolled into a summary. */
    public List<MemoryNode> unrolled(String owner, MemoryLevel level) {
        var now = clock.instant();
        var result = new ArrayList<MemoryNode>();
        for (var id : byOwner.getOrDefault(owner, Set.of())) {
            var node = nodes.get(id);
            if (node != null && node.level() == level && !parents.containsKey(id) && !node.isExpired(now)) {
                result.add(node);
            }
        }
        return result;
    }

    /** Live nodes of {@code owner}, oldest first. */
    public List<MemoryNode> ownedBy(String owner) {
        var now = clock.instant();
        var result = new ArrayList<MemoryNode>();
        for (var id : byOwner.getOrDefault(owner, Set.of())) {
            var node = nodes.get(id);
            if (node != null && !node.isExpired(now)) result.add(view(node));
        }
        result.sort(Comparator.comparing(MemoryNode::createdAt));
        return result;
    }

    public Set<String> owners() {
        return Set.copyOf(byOwner.keySet());
    }

    /** Snapshot of every live node, oldest first. */
    public List<MemoryNode> snapshot() {
        var now = clock.instant();
        return nodes.values().stream()
                .filter(n -> !n.isExpired(now))
                .sorted(Comparator.comparing(MemoryNode::createdAt))
                .map(this::view)
                .toList();
    }

    public int size() {
        return nodes.size();
    }

    // --- Mutations ---

    /** Increments {@code access_count}; persisted lazily by {@link #flush()}. */
    public Optional<MemoryNode> touch(String nodeId) {
        var now = clock.instant();
        var updated = nodes.computeIfPresent(nodeId, (id, node) -> node.touched(now));
        if (updated == null) return Optional.empty();
        dirty.add(nodeId);
        return Optional.of(view(updated));
    }

    public Outcome<MemoryNode> updateConsent(String nodeId, String requester, ConsentLevel newLevel) {
        return updateConsent(nodeId, requester, newLevel, (node, who) -> node.owner().equals(who));
    }

    /**
     * Changes the consent level when {@code mayModify} accepts the requester. The check runs
     * inside the node's update, so it sees the same version that gets replaced.
     */
    public Outcome<MemoryNode> updateConsent(String nodeId, String requester, ConsentLevel newLevel,
                                             BiPredicate<MemoryNode, String> mayModify) {
        if (newLevel == null) return Outcome.invalid("consent level is required");
        return mutate(nodeId, node -> {
            if (!mayModify.test(view(node), requester)) return null;
            return node.withConsent(newLevel);
        });
    }

    public Outcome<MemoryNode> updateImportance(String nodeId, String requester, double importance) {
        if (!validImportance(importance)) {
            return Outcome.invalid("importance must be within [0, 1]: " + importance);
        }
        return mutate(nodeId, node -> node.owner().equals(requester) ? node.withImportance(importance) : null);
    }

    /** Replaces the ttl, still measured from {@code created_at}. Owner only. */
    public Outcome<MemoryNode> updateTtl(String nodeId, String requester, Duration ttl) {
        var found = get(nodeId);
        if (!found.isOk()) return found;
        var ttlProblem = checkTtl(found.value().createdAt(), ttl);
        if (ttlProblem != null) return Outcome.invalid(ttlProblem);
        return mutate(nodeId, node -> node.owner().equals(requester) ? node.withTtl(ttl) : null);
    }

    private interface Mutation {
        /** Returns the replacement, or null to refuse. */
        MemoryNode apply(MemoryNode current);
    }

    private Outcome<MemoryNode> mutate(String nodeId, Mutation mutation) {
        if (!exists(nodeId)) return Outcome.notFound("No such node: " + nodeId);
        var result = new AtomicReference<Outcome<MemoryNode>>(Outcome.notFound("No such node: " + nodeId));
        nodes.computeIfPresent(nodeId, (id, node) -> {
            var replacement = mutation.apply(node);
            if (replacement == null) {
                result.set(Outcome.forbidden("Not permitted to modify node " + id));
                return node;
            }
            repository.saveNode(replacement);
            dirty.remove(id);
            result.set(Outcome.ok(view(replacement)));
            return replacement;
        });
        return result.get();
    }

    // --- Expiry ---

    public int deleteExpired() {
        var now = clock.instant();
        int count = 0;
        for (var node : List.copyOf(nodes.values())) {
            if (node.isExpired(now) && evict(node.id())) count++;
        }
        if (count > 0) log.info("Evicted {} expired node(s)", count);
        return count;
    }

    /** Explicit delete by the owner; goes through the same path as expiry. */
    public Outcome<Void> delete(String nodeId, String requester) {
        var found = get(nodeId);
        if (!found.isOk()) return found.failure();
        if (!found.value().owner().equals(requester)) {
            return Outcome.forbidden("Only the owner may delete node " + nodeId);
        }
        if (!evict(nodeId)) return Outcome.notFound("No such node: " + nodeId);
        log.debug("Deleted node {} on request of {}", nodeId, requester);
        return Outcome.ok(null);
    }

    private boolean evict(String nodeId) {
        repository.deleteNode(nodeId);
        var removed = nodes.remove(nodeId);
        if (removed == null) return false;

        var owned = byOwner.get(removed.owner());
        if (owned != null) owned.remove(nodeId);
        dirty.remove(nodeId);
        parents.remove(nodeId);
        for (var child : removed.children()) {
            parents.remove(child, nodeId);
        }
        for (var edge : edges.removeTouching(nodeId)) {
            repository.deleteEdge(edge.id());
        }
        log.debug("Evicted node {} (owner={}, level={})", nodeId, removed.owner(), removed.level());
        for (var listener : removalListeners) {
            listener.accept(removed);
        }
        return true;
    }

    // --- Edges ---

    public MemoryEdge link(String source, String target, String relation, double weight, String createdBy) {
        var edge = new MemoryEdge(UUID.randomUUID().toString(), source, target, relation, weight,
                createdBy, clock.instant());
        repository.saveEdge(edge);
        edges.add(edge);
        return edge;
    }

    public List<MemoryEdge> outgoing(String nodeId, String relation) {
        return edges.outgoing(nodeId, relation);
    }

    public int edgeCount() {
        return edges.size();
    }

    // --- Durability ---

    /** Writes nodes whose bookkeeping fields changed since the last flush. */
    public int flush() {
        int written = 0;
        for (var id : List.copyOf(dirty)) {
            dirty.remove(id);
            try {
                var saved = nodes.computeIfPresent(id, (k, node) -> {
                    repository.saveNode(node);
                    return node;
                });
                if (saved != null) written++;
            } catch (RuntimeException e) {
                dirty.add(id);
                throw e;
            }
        }
        return written;
    }

    private void load() {
        var now = clock.instant();
        int dropped = 0;
        for (var node : repository.loadNodes()) {
            if (node.isExpired(now)) {
                repository.deleteNode(node.id());
                dropped++;
                continue;
            }
            var stored = node.withParent(null);
            nodes.put(stored.id(), stored);
            byOwner.computeIfAbsent(stored.owner(), k -> ConcurrentHashMap.newKeySet()).add(stored.id());
        }
        for (var node : nodes.values()) {
            for (var child : node.children()) {
                if (nodes.containsKey(child)) parents.put(child, node.id());
            }
        }
        for (var edge : repository.loadEdges()) {
            if (nodes.containsKey(edge.source()) && nodes.containsKey(edge.target())) {
                edges.add(edge);
            } else {
                repository.deleteEdge(edge.id());
            }
        }
        if (!nodes.isEmpty() || dropped > 0) {
            log.info("Loaded {} node(s), {} edge(s); dropped {} expired during downtime",
                    nodes.size(), edges.size(), dropped);
        }
    }

    private MemoryNode view(MemoryNode node) {
        return node.withParent(parents.get(node.id()));
    }

    /** Null when {@code ttl} is usable from {@code start}, otherwise the reason it is not. */
    private static String checkTtl(Instant start, Duration ttl) {
        if (ttl == null) return "ttl is required";
        if (ttl.isZero() || ttl.isNegative()) return "ttl must be positive: " + ttl;
        if (Deadlines.after(start, ttl).isEmpty()) return "ttl is too large: " + ttl;
        return null;
    }

    private static boolean validImportance(double importance) {
        return Double.isFinite(importance) && importance >= 0.0 && importance <= 1.0;
    }
}
