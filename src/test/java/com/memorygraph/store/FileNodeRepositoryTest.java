package com.memorygraph.store;

import com.memorygraph.shared.config.StorageConfig;
import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FileNodeRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @TempDir Path tempDir;
    private FileNodeRepository repository;

    @BeforeEach
    void setUp() {
        repository = new FileNodeRepository(StorageConfig.at(tempDir));
    }

    private static MemoryNode summary(String id, String parent) {
        return new MemoryNode(id, "office-a", MemoryLevel.DAILY, "day summary", new float[]{0.6f, 0.8f},
                ConsentLevel.RESTRICTED, T0, Duration.ofDays(7), 3, T0.plusSeconds(30), 0.9,
                Set.of("ops", "billing"), List.of("c1", "c2"), parent);
    }

    @Test
    void nodeSurvivesReload() {
        repository.saveNode(summary("s1", null));

        var loaded = new FileNodeRepository(StorageConfig.at(tempDir)).loadNodes();
        assertEquals(1, loaded.size());
        var node = loaded.get(0);
        assertEquals("s1", node.id());
        assertEquals(MemoryLevel.DAILY, node.level());
        assertEquals(ConsentLevel.RESTRICTED, node.consent());
        assertEquals(T0, node.createdAt());
        assertEquals(Duration.ofDays(7), node.ttl());
        assertEquals(3, node.accessCount());
        assertEquals(0.9, node.importance());
        assertArrayEquals(new float[]{0.6f, 0.8f}, node.similarityKey());
        assertThat(node.tags()).containsExactlyInAnyOrder("ops", "billing");
        assertEquals(List.of("c1", "c2"), node.children());
    }

    @Test
    void parentIsNotPersisted() {
        repository.saveNode(summary("s1", "w1"));
        assertNull(repository.loadNodes().get(0).parent());
    }

    @Test
    void saveReplacesPreviousVersion() {
        var node = summary("s1", null);
        repository.saveNode(node);
        repository.saveNode(node.withConsent(ConsentLevel.PUBLIC));

        var loaded = repository.loadNodes();
        assertEquals(1, loaded.size());
        assertEquals(ConsentLevel.PUBLIC, loaded.get(0).consent());
    }

    @Test
    void deleteRemovesRecordAndToleratesMissing() {
        repository.saveNode(summary("s1", null));
        repository.deleteNode("s1");
        repository.deleteNode("s1");
        assertTrue(repository.loadNodes().isEmpty());
    }

    @Test
    void grantsAndEdgesRoundTrip() {
        var grant = new AccessGrant("g1", "s1", "office-a", "office-b", T0.plusSeconds(3600), true);
        var edge = new MemoryEdge("e1", "s1", "s2", "follows", 0.5, "office-a", T0);
        repository.saveGrant(grant);
        repository.saveEdge(edge);

        assertEquals(List.of(grant), repository.loadGrants());
        assertEquals(List.of(edge), repository.loadEdges());

        repository.deleteGrant("g1");
        assertTrue(repository.loadGrants().isEmpty());
    }

    @Test
    void unreadableRecordIsSkipped() throws IOException {
        repository.saveNode(summary("s1", null));
        Files.writeString(tempDir.resolve("nodes").resolve("broken.json"), "{not json");

        var loaded = repository.loadNodes();
        assertEquals(1, loaded.size());
        assertEquals("s1", loaded.get(0).id());
    }

    @Test
    void noTempFilesLeftBehind() throws IOException {
        repository.saveNode(summary("s1", null));
        try (var files = Files.list(tempDir.resolve("nodes"))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("s1.json");
        }
    }
}
