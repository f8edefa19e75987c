package com.memorygraph.index;

import java.time.Instant;

public record SearchHit(String nodeId, double score, double importance, Instant createdAt) {}
