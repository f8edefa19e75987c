package com.memorygraph.shared.model;

import java.time.Instant;

public record MemoryEdge(
    String id,
    String source,
    String target,
    String relation,
    double weight,
    String createdBy,
    Instant createdAt
) {}
