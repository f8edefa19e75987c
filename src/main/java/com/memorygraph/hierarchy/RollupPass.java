package com.memorygraph.hierarchy;

import com.memorygraph.shared.model.MemoryNode;

import java.util.List;

public record RollupPass(List<MemoryNode> summaries, List<String> warnings, int timeouts, boolean cancelled) {
    public RollupPass {
        summaries = List.copyOf(summaries);
        warnings = List.copyOf(warnings);
    }
}
