package com.memorygraph.hierarchy;

import com.memorygraph.shared.model.MemoryLevel;
import com.memorygraph.shared.model.MemoryNode;

import java.util.List;
import java.util.stream.Collectors;

public class TruncatingSummarizer implements Summarizer {

    private final int maxChars;

    public TruncatingSummarizer(int maxChars) {
        if (maxChars <= 0) throw new IllegalArgumentException("maxChars must be positive");
        this.maxChars = maxChars;
    }

    @Override
    public String summarize(MemoryLevel targetLevel, List<MemoryNode> sources) {
        var joined = sources.stream().map(MemoryNode::content).collect(Collectors.joining("\n"));
        if (joined.length() <= maxChars) return joined;
        return joined.substring(0, maxChars) + "...";
    }
}
