package com.memorygraph.shared.config;

/**
 * Remote embedding endpoint. A blank {@code baseUrl} selects the local hashing key function.
 */
public record EmbeddingConfig(String baseUrl, String apiKey, String model) {
    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("", "", "nomic-embed-text");
    }

    public boolean remote() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
