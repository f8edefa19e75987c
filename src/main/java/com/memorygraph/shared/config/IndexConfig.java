package com.memorygraph.shared.config;

public record IndexConfig(int dimensions, int overfetch) {
    public static IndexConfig defaults() {
        return new IndexConfig(256, 4);
    }
}
