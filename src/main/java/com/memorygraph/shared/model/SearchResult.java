package com.memorygraph.shared.model;

public record SearchResult(MemoryNode node, double score) {}
