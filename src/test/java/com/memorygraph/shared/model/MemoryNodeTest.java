package com.memorygraph.shared.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MemoryNodeTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private static MemoryNode node(MemoryLevel level, List<String> children, String parent) {
        return new MemoryNode("n1", "office-a", level, "content", new float[]{1f, 0f},
                ConsentLevel.SHARED, T0, Duration.ofMinutes(10), 0, T0, 0.5,
                Set.of("ops"), children, parent);
    }

    @Test
    void expiresStrictlyAfterTtl() {
        var n = node(MemoryLevel.ATOMIC, List.of(), null);
        assertEquals(T0.plus(Duration.ofMinutes(10)), n.expiresAt());
        assertFalse(n.isExpired(T0.plus(Duration.ofMinutes(10))));
        assertTrue(n.isExpired(T0.plus(Duration.ofMinutes(10)).plusMillis(1)));
    }

    @Test
    void atomicNodeRejectsChildren() {
        assertThrows(IllegalArgumentException.class, () -> node(MemoryLevel.ATOMIC, List.of("c1"), null));
    }

    @Test
    void monthlyNodeRejectsParent() {
        assertThrows(IllegalArgumentException.class, () -> node(MemoryLevel.MONTHLY, List.of("w1"), "x"));
    }

    @Test
    void similarityKeyIsCopied() {
        var key = new float[]{1f, 0f};
        var n = new MemoryNode("n1", "a", MemoryLevel.ATOMIC, "c", key, ConsentLevel.PUBLIC, T0,
                Duration.ofDays(1), 0, T0, 0.5, Set.of(), List.of(), null);
        key[0] = 9f;
        n.similarityKey()[1] = 9f;
        assertArrayEquals(new float[]{1f, 0f}, n.similarityKey());
    }

    @Test
    void touchedIncrementsAccessCount() {
        var later = T0.plusSeconds(5);
        var touched = node(MemoryLevel.ATOMIC, List.of(), null).touched(later).touched(later);
        assertEquals(2, touched.accessCount());
        assertEquals(later, touched.lastAccessedAt());
    }

    @Test
    void mostRestrictiveConsentWins() {
        assertEquals(ConsentLevel.PRIVATE, ConsentLevel.mostRestrictive(ConsentLevel.PUBLIC, ConsentLevel.PRIVATE));
        assertEquals(ConsentLevel.RESTRICTED, ConsentLevel.mostRestrictive(ConsentLevel.RESTRICTED, ConsentLevel.SHARED));
    }

    @Test
    void outcomeFailureKeepsStatus() {
        Outcome<MemoryNode> missing = Outcome.notFound("gone");
        Outcome<String> retyped = missing.failure();
        assertEquals(Outcome.Status.NOT_FOUND, retyped.status());
        assertEquals("gone", retyped.message());
        assertThrows(IllegalStateException.class, () -> Outcome.ok("x").failure());
        assertThrows(IllegalStateException.class, retyped::orElseThrow);
    }

    @Test
    void equalSnapshotsCompareEqual() {
        var a = node(MemoryLevel.DAILY, List.of("c1"), null);
        var b = node(MemoryLevel.DAILY, List.of("c1"), null);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, a.touched(T0.plusSeconds(1)));
        assertNotEquals(a, new MemoryNode("n1", "office-a", MemoryLevel.DAILY, "content", new float[]{0f, 1f},
                ConsentLevel.SHARED, T0, Duration.ofMinutes(10), 0, T0, 0.5, Set.of("ops"), List.of("c1"), null));
    }

    @Test
    void expiryOfUnrepresentableTtlSaturates() {
        var n = node(MemoryLevel.ATOMIC, List.of(), null).withTtl(Duration.ofSeconds(Long.MAX_VALUE));
        assertEquals(Instant.MAX, n.expiresAt());
        assertFalse(n.isExpired(T0.plus(Duration.ofDays(365 * 1000))));
    }
}
