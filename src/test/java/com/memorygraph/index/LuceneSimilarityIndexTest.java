package com.memorygraph.index;

import com.memorygraph.shared.CancellationSignal;
import com.memorygraph.shared.config.IndexConfig;
import com.memorygraph.shared.model.ConsentLevel;
import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LuceneSimilarityIndexTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final IndexConfig CONFIG = new IndexConfig(4, 4);

    @TempDir Path tempDir;
    private LuceneSimilarityIndex index;

    @BeforeEach
    void setUp() {
        index = new LuceneSimilarityIndex(new ByteBuffersDirectory(), CONFIG);
    }

    @AfterEach
    void tearDown() { index.close(); }

    private static MemoryNode node(String id, float[] key, double importance, Instant createdAt, Set<String> tags) {
        return new MemoryNode(id, "office-a", MemoryLevel.ATOMIC, id, key, ConsentLevel.PUBLIC, createdAt,
                Duration.ofDays(1), 0, createdAt, importance, tags, List.of(), null);
    }

    private static MemoryNode node(String id, float[] key) {
        return node(id, key, 0.5, T0, Set.of());
    }

    private List<SearchHit> search(float[] key, int k, double minScore) {
        return index.search(SearchQuery.of(key, k, minScore), CancellationSignal.none());
    }

    @Test
    void emptyIndexReturnsNothing() {
        assertTrue(search(new float[]{1, 0, 0, 0}, 5, 0).isEmpty());
    }

    @Test
    void ordersByDescendingScore() {
        index.index(node("far", new float[]{0, 1, 0, 0}));
        index.index(node("exact", new float[]{1, 0, 0, 0}));
        index.index(node("near", new float[]{1, 1, 0, 0}));

        var hits = search(new float[]{1, 0, 0, 0}, 3, 0);
        assertThat(hits).extracting(SearchHit::nodeId).containsExactly("exact", "near", "far");
        assertEquals(1.0, hits.get(0).score(), 1e-5);
        assertEquals(0.5, hits.get(2).score(), 1e-5);
    }

    @Test
    void tiesBreakOnImportanceThenRecency() {
        var key = new float[]{0, 0, 1, 0};
        index.index(node("old-low", key, 0.2, T0, Set.of()));
        index.index(node("old-high", key, 0.9, T0, Set.of()));
        index.index(node("new-low", key, 0.2, T0.plusSeconds(60), Set.of()));

        var hits = search(key, 3, 0);
        assertThat(hits).extracting(SearchHit::nodeId).containsExactly("old-high", "new-low", "old-low");
    }

    @Test
    void minScoreAndKLimitResults() {
        index.index(node("a", new float[]{1, 0, 0, 0}));
        index.index(node("b", new float[]{1, 0.1f, 0, 0}));
        index.index(node("c", new float[]{0, 1, 0, 0}));

        assertThat(search(new float[]{1, 0, 0, 0}, 5, 0.9)).extracting(SearchHit::nodeId)
                .containsExactly("a", "b");
        assertThat(search(new float[]{1, 0, 0, 0}, 1, 0)).extracting(SearchHit::nodeId)
                .containsExactly("a");
    }

    @Test
    void tagFilterRestrictsCandidates() {
        var key = new float[]{1, 0, 0, 0};
        index.index(node("ops", key, 0.5, T0, Set.of("ops")));
        index.index(node("billing", key, 0.5, T0, Set.of("billing", "finance")));
        index.index(node("untagged", key));

        var hits = index.search(new SearchQuery(key, 5, 0, Set.of("finance", "ops")), CancellationSignal.none());
        assertThat(hits).extracting(SearchHit::nodeId).containsExactlyInAnyOrder("ops", "billing");
    }

    @Test
    void removeAndReindex() {
        index.index(node("a", new float[]{1, 0, 0, 0}, 0.1, T0, Set.of()));
        index.index(node("b", new float[]{1, 0, 0, 0}, 0.5, T0, Set.of()));
        assertThat(search(new float[]{1, 0, 0, 0}, 2, 0)).extracting(SearchHit::nodeId).containsExactly("b", "a");

        index.index(node("a", new float[]{1, 0, 0, 0}, 0.9, T0, Set.of()));
        assertThat(search(new float[]{1, 0, 0, 0}, 2, 0)).extracting(SearchHit::nodeId).containsExactly("a", "b");

        index.remove("b");
        assertEquals(Set.of("a"), index.indexedIds());
    }

    @Test
    void rejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> search(new float[]{1, 0}, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> search(new float[]{0, 0, 0, 0}, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> search(new float[]{Float.NaN, 0, 0, 0}, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> search(new float[]{1, 0, 0, 0}, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> index.index(node("z", new float[]{0, 0, 0, 0})));
    }

    @Test
    void cancelledSearchThrows() {
        index.index(node("a", new float[]{1, 0, 0, 0}));
        var signal = new CancellationSignal();
        signal.cancel();
        assertThrows(CancellationException.class,
                () -> index.search(SearchQuery.of(new float[]{1, 0, 0, 0}, 1, 0), signal));
    }

    @Test
    void entriesSurviveReopen() {
        var path = tempDir.resolve("index");
        try (var durable = new LuceneSimilarityIndex(path, CONFIG)) {
            durable.index(node("kept", new float[]{0, 0, 0, 1}));
        }
        try (var reopened = new LuceneSimilarityIndex(path, CONFIG)) {
            assertEquals(Set.of("kept"), reopened.indexedIds());
            var hits = reopened.search(SearchQuery.of(new float[]{0, 0, 0, 1}, 1, 0.5), CancellationSignal.none());
            assertEquals("kept", hits.get(0).nodeId());
        }
    }
}
