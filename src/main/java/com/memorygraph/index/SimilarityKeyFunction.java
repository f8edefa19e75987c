package com.memorygraph.index;

/**
 * Derives a similarity key from text: for new nodes, for summaries and for text queries.
 */
public interface SimilarityKeyFunction {
    float[] keyFor(String content);
    int dimensions();
}
