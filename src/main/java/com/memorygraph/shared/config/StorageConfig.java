package com.memorygraph.shared.config;

import java.nio.file.Path;

public record StorageConfig(
    Path dataDir,
    int retries,
    long retryDelayMs
) {
    public static final Path DEFAULT_DATA_DIR = Path.of(
        System.getProperty("user.home"), ".memorygraph", "data"
    );

    public static StorageConfig defaults() {
        return new StorageConfig(DEFAULT_DATA_DIR, 2, 100);
    }

    public static StorageConfig at(Path dataDir) {
        var defaults = defaults();
        return new StorageConfig(dataDir, defaults.retries(), defaults.retryDelayMs());
    }

    public Path nodesDir() { return dataDir.resolve("nodes"); }

    public Path grantsDir() { return dataDir.resolve("grants"); }

    public Path edgesDir() { return dataDir.resolve("edges"); }

    public Path indexDir() { return dataDir.resolve("index"); }
}
