package com.memorygraph.shared.model;

import com.memorygraph.shared.Deadlines;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of a memory node. The store replaces a node with an updated copy
 * on every mutation, so a reference handed out never changes underneath its holder.
 *
 * <p>{@code parent} is not part of the stored record: it is resolved from the
 * store's parent index whenever a view is handed out.
 */
public record MemoryNode(
    String id,
    String owner,
    MemoryLevel level,
    String content,
    float[] similarityKey,
    ConsentLevel consent,
    Instant createdAt,
    Duration ttl,
    long accessCount,
    Instant lastAccessedAt,
    double importance,
    Set<String> tags,
    List<String> children,
    String parent
) {
    public MemoryNode {
        similarityKey = similarityKey == null ? new float[0] : similarityKey.clone();
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        children = children == null ? List.of() : List.copyOf(children);
        if (!level.canHaveChildren() && !children.isEmpty()) {
            throw new IllegalArgumentException("Atomic node cannot have children: " + id);
        }
        if (!level.canHaveParent() && parent != null) {
            throw new IllegalArgumentException("Monthly node cannot have a parent: " + id);
        }
    }

    @Override
    public float[] similarityKey() {
        return similarityKey.clone();
    }

    /** Saturates at {@link Instant#MAX} for a ttl too large to add to {@code createdAt}. */
    public Instant expiresAt() {
        return Deadlines.after(createdAt, ttl).orElse(Instant.MAX);
    }

    /** Expired once {@code created_at + ttl} lies strictly before {@code now}. */
    public boolean isExpired(Instant now) {
        return expiresAt().isBefore(now);
    }

    public MemoryNode withTtl(Duration newTtl) {
        return new MemoryNode(id, owner, level, content, similarityKey, consent, createdAt, newTtl,
                accessCount, lastAccessedAt, importance, tags, children, parent);
    }

    public MemoryNode withConsent(ConsentLevel newConsent) {
        return new MemoryNode(id, owner, level, content, similarityKey, newConsent, createdAt, ttl,
                accessCount, lastAccessedAt, importance, tags, children, parent);
    }

    public MemoryNode withImportance(double newImportance) {
        return new MemoryNode(id, owner, level, content, similarityKey, consent, createdAt, ttl,
                accessCount, lastAccessedAt, newImportance, tags, children, parent);
    }

    public MemoryNode withParent(String newParent) {
        return new MemoryNode(id, owner, level, content, similarityKey, consent, createdAt, ttl,
                accessCount, lastAccessedAt, importance, tags, children, newParent);
    }

    public MemoryNode touched(Instant at) {
        return new MemoryNode(id, owner, level, content, similarityKey, consent, createdAt, ttl,
                accessCount + 1, at, importance, tags, children, parent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var other = (MemoryNode) o;
        return accessCount == other.accessCount
                && Double.compare(importance, other.importance) == 0
                && id.equals(other.id)
                && owner.equals(other.owner)
                && level == other.level
                && content.equals(other.content)
                && Arrays.equals(similarityKey, other.similarityKey)
                && consent == other.consent
                && createdAt.equals(other.createdAt)
                && ttl.equals(other.ttl)
                && Objects.equals(lastAccessedAt, other.lastAccessedAt)
                && tags.equals(other.tags)
                && children.equals(other.children)
                && Objects.equals(parent, other.parent);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, owner, level, content, consent, createdAt, ttl, accessCount,
                lastAccessedAt, importance, tags, children, parent);
        return 31 * result + Arrays.hashCode(similarityKey);
    }

    @Override
    public String toString() {
        return "MemoryNode[id=" + id + ", owner=" + owner + ", level=" + level + ", consent=" + consent
                + ", createdAt=" + createdAt + ", ttl=" + ttl + ", accessCount=" + accessCount
                + ", parent=" + parent + ", children=" + children + "]";
    }
}
