package com.memorygraph.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memorygraph.shared.StorageUnavailableException;
import com.memorygraph.shared.config.EmbeddingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Key function backed by an OpenAI-compatible {@code /embeddings} endpoint.
 */
public class EmbeddingService implements SimilarityKeyFunction {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final HttpClient httpClient;

    public EmbeddingService(EmbeddingConfig config, int dimensions) {
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.apiKey = config.apiKey();
        this.model = config.model();
        this.dimensions = dimensions;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public float[] keyFor(String content) {
        HttpResponse<String> resp;
        try {
            var body = MAPPER.writeValueAsString(Map.of("model", model, "input", content));
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/embeddings"))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Embedding request failed", e);
            throw new StorageUnavailableException("Embedding endpoint unreachable: " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while embedding", e);
        }
        if (resp.statusCode() != 200) {
            log.error("Embedding API error {}: {}", resp.statusCode(), resp.body());
            throw new StorageUnavailableException("Embedding API returned HTTP " + resp.statusCode());
        }
        try {
            var arr = MAPPER.readTree(resp.body()).path("data").path(0).path("embedding");
            if (arr.size() != dimensions) {
                log.error("Embedding has {} dimensions, index expects {}", arr.size(), dimensions);
                throw new StorageUnavailableException(
                        "Embedding has " + arr.size() + " dimensions, index expects " + dimensions);
            }
            var vec = new float[arr.size()];
            for (int i = 0; i < arr.size(); i++) {
                vec[i] = (float) arr.get(i).asDouble();
            }
            return vec;
        } catch (IOException e) {
            throw new StorageUnavailableException("Malformed embedding response", e);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
