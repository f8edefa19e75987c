package com.memorygraph.graph;

import com.memorygraph.shared.MutableClock;
import com.memorygraph.shared.config.GraphConfig;
import com.memorygraph.shared.config.RollupConfig;
import com.memorygraph.shared.config.StorageConfig;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.NewMemory;
import com.memorygraph.shared.model.Outcome;
import com.memorygraph.shared.model.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MemoryGraphDurabilityTest {

    @TempDir Path tempDir;
    private MutableClock clock;
    private GraphConfig config;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        config = GraphConfig.defaults()
                .withStorage(StorageConfig.at(tempDir))
                .withRollup(RollupConfig.defaults().withThresholds(2, 7, 4));
    }

    private static List<String> ids(Outcome<List<SearchResult>> results) {
        return results.orElseThrow().stream().map(r -> r.node().id()).toList();
    }

    @Test
    void stateSurvivesRestart() {
        String kept;
        String other;
        String summaryId;
        String grantId;
        List<String> searchBefore;
        try (var graph = MemoryGraphFactory.open(config, clock)) {
            kept = graph.createMemory(NewMemory.of("A", "database failover drill", ConsentLevel.SHARED)
                    .withImportance(0.8).withTags(Set.of("ops"))).orElseThrow().id();
            clock.advance(Duration.ofSeconds(1));
            other = graph.createMemory("A", "failover drill follow-ups", ConsentLevel.PUBLIC).orElseThrow().id();
            grantId = graph.grantAccess(kept, "A", "B", Duration.ofHours(2), false).orElseThrow().id();
            graph.linkMemories(kept, other, "followed-by", 1.0, "A").orElseThrow();
            summaryId = graph.triggerMaintenance().summaryIds().get(0);
            graph.readMemory(kept, "A");
            searchBefore = ids(graph.searchMemories("failover drill", "B", 5, 0.0));
        }

        clock.advance(Duration.ofMinutes(5));
        try (var graph = MemoryGraphFactory.open(config, clock)) {
            var node = graph.readMemory(kept, "B").orElseThrow();
            assertEquals("database failover drill", node.content());
            assertEquals(Set.of("ops"), node.tags());
            assertEquals(0.8, node.importance());
            assertEquals(summaryId, node.parent());
            // one read and one search before the restart, plus this read
            assertEquals(3, node.accessCount());

            assertEquals(searchBefore, ids(graph.searchMemories("failover drill", "B", 5, 0.0)));
            assertEquals(List.of(kept, other), graph.childrenOf(summaryId, "A").orElseThrow().stream()
                    .map(n -> n.id()).toList());
            assertEquals(List.of(other), graph.neighbors(kept, "A", "followed-by").orElseThrow().stream()
                    .map(n -> n.id()).toList());

            assertTrue(graph.revokeAccess(grantId, "A").isOk());
            assertEquals(Outcome.Status.FORBIDDEN, graph.readMemory(kept, "B").status());
        }
    }

    @Test
    void nodesExpiredDuringDowntimeAreGone() {
        String brief;
        String lasting;
        try (var graph = MemoryGraphFactory.open(config, clock)) {
            brief = graph.createMemory(NewMemory.of("A", "temporary token note", ConsentLevel.PUBLIC)
                    .withTtl(Duration.ofMinutes(1))).orElseThrow().id();
            lasting = graph.createMemory("A", "permanent token policy", ConsentLevel.PUBLIC).orElseThrow().id();
            graph.grantAccess(brief, "A", "B", Duration.ofDays(3), false);
        }

        clock.advance(Duration.ofHours(1));
        try (var graph = MemoryGraphFactory.open(config, clock)) {
            assertEquals(Outcome.Status.NOT_FOUND, graph.readMemory(brief, "A").status());
            assertEquals(List.of(lasting), ids(graph.searchMemories("token", "A", 5, 0.0)));
            assertEquals(0, graph.stats().grants());
        }
    }

    @Test
    void lostIndexIsRebuiltOnOpen() throws IOException {
        String id;
        try (var graph = MemoryGraphFactory.open(config, clock)) {
            id = graph.createMemory("A", "certificate rotation schedule", ConsentLevel.PUBLIC).orElseThrow().id();
        }
        try (Stream<Path> files = Files.walk(config.storage().indexDir())) {
            for (var p : files.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }

        try (var graph = MemoryGraphFactory.open(config, clock)) {
            assertEquals(List.of(id), ids(graph.searchMemories("certificate rotation schedule", "B", 1, 0.9)));
        }
    }
}
