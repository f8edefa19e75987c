package com.memorygraph.shared.config;

public record GraphConfig(
    StorageConfig storage,
    TtlConfig ttl,
    RollupConfig rollup,
    IndexConfig index,
    EmbeddingConfig embedding
) {
    public static GraphConfig defaults() {
        return new GraphConfig(
            StorageConfig.defaults(),
            TtlConfig.defaults(),
            RollupConfig.defaults(),
            IndexConfig.defaults(),
            EmbeddingConfig.defaults()
        );
    }

    public GraphConfig withStorage(StorageConfig storage) {
        return new GraphConfig(storage, ttl, rollup, index, embedding);
    }

    public GraphConfig withRollup(RollupConfig rollup) {
        return new GraphConfig(storage, ttl, rollup, index, embedding);
    }
}
