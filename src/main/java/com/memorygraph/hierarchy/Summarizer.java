package com.memorygraph.hierarchy;

import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;

/**
 * Produces the content of a summary node. Implementations may call out to an external
 * text summarizer; the aggregator bounds each call with the configured timeout and
 * interrupts it when the deadline passes.
 */
@FunctionalInterface
public interface Summarizer {
    /**
     * @param sources oldest first
     */
    String summarize(MemoryLevel targetLevel, List<MemoryNode> sources) throws Exception;
}
