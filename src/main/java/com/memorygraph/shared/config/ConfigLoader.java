package com.memorygraph.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".memorygraph", "config.yaml"
    );

    public static GraphConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static GraphConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var storage = (Map<String, Object>) raw.getOrDefault("storage", Map.of());
        var ttl = (Map<String, Object>) raw.getOrDefault("ttl", Map.of());
        var rollup = (Map<String, Object>) raw.getOrDefault("rollup", Map.of());
        var index = (Map<String, Object>) raw.getOrDefault("index", Map.of());
        var embedding = (Map<String, Object>) raw.getOrDefault("embedding", Map.of());

        return new GraphConfig(
            parseStorageConfig(storage),
            parseTtlConfig(ttl),
            parseRollupConfig(rollup),
            parseIndexConfig(index),
            parseEmbeddingConfig(embedding)
        );
    }

    private static StorageConfig parseStorageConfig(Map<String, Object> storage) {
        var defaults = StorageConfig.defaults();
        var dataDir = envOrDefault("MEMORYGRAPH_DATA_DIR",
            String.valueOf(storage.getOrDefault("data-dir", defaults.dataDir().toString())));
        return new StorageConfig(
            Path.of(expandHome(dataDir)),
            Integer.parseInt(String.valueOf(storage.getOrDefault("retries", defaults.retries()))),
            Long.parseLong(String.valueOf(storage.getOrDefault("retry-delay-ms", defaults.retryDelayMs())))
        );
    }

    private static TtlConfig parseTtlConfig(Map<String, Object> ttl) {
        var defaults = TtlConfig.defaults();
        return new TtlConfig(
            seconds(ttl, "atomic", defaults.atomic()),
            seconds(ttl, "daily", defaults.daily()),
            seconds(ttl, "weekly", defaults.weekly()),
            seconds(ttl, "monthly", defaults.monthly())
        );
    }

    private static RollupConfig parseRollupConfig(Map<String, Object> rollup) {
        var defaults = RollupConfig.defaults();
        return new RollupConfig(
            Integer.parseInt(String.valueOf(rollup.getOrDefault("atomic-to-daily", defaults.atomicToDaily()))),
            Integer.parseInt(String.valueOf(rollup.getOrDefault("daily-to-weekly", defaults.dailyToWeekly()))),
            Integer.parseInt(String.valueOf(rollup.getOrDefault("weekly-to-monthly", defaults.weeklyToMonthly()))),
            seconds(rollup, "summarizer-timeout", defaults.summarizerTimeout()),
            Integer.parseInt(String.valueOf(rollup.getOrDefault("max-summary-chars", defaults.maxSummaryChars())))
        );
    }

    private static IndexConfig parseIndexConfig(Map<String, Object> index) {
        var defaults = IndexConfig.defaults();
        return new IndexConfig(
            Integer.parseInt(String.valueOf(index.getOrDefault("dimensions", defaults.dimensions()))),
            Integer.parseInt(String.valueOf(index.getOrDefault("overfetch", defaults.overfetch())))
        );
    }

    private static EmbeddingConfig parseEmbeddingConfig(Map<String, Object> embedding) {
        var defaults = EmbeddingConfig.defaults();
        return new EmbeddingConfig(
            envOrDefault("MEMORYGRAPH_EMBEDDING_URL",
                String.valueOf(embedding.getOrDefault("base-url", defaults.baseUrl()))),
            envOrDefault("MEMORYGRAPH_EMBEDDING_KEY",
                String.valueOf(embedding.getOrDefault("api-key", defaults.apiKey()))),
            String.valueOf(embedding.getOrDefault("model", defaults.model()))
        );
    }

    private static Duration seconds(Map<String, Object> section, String key, Duration fallback) {
        var value = section.get(key);
        if (value == null) return fallback;
        return Duration.ofSeconds(Long.parseLong(String.valueOf(value)));
    }

    private static String expandHome(String path) {
        return path.startsWith("~/") ? System.getProperty("user.home") + path.substring(1) : path;
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
