package com.memorygraph.index;

import com.memorygraph.shared.CancellationSignal;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;
import java.util.Set;

/**
 * Nearest-neighbour search over similarity keys. Consent-agnostic: callers filter the
 * returned ids themselves.
 */
public interface SimilarityIndex extends AutoCloseable {

    /** Inserts or replaces the entry for {@code node.id()}. */
    void index(MemoryNode node);

    void remove(String nodeId);

    /**
     * Up to {@code query.k()} hits with score at least {@code query.minScore()}, by descending
     * score, then descending importance, then most recent creation.
     */
    List<SearchHit> search(SearchQuery query, CancellationSignal signal);

    Set<String> indexedIds();

    @Override
    void close();
}
