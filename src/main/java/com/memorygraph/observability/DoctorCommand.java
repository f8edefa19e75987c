package com.memorygraph.observability;

import com.memorygraph.shared.config.EmbeddingConfig;
import com.memorygraph.shared.config.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;

/**
 * Environment checks printed as {@code [OK]}, {@code [WARN]} or {@code [FAIL]} lines.
 */
public class DoctorCommand {

    private static final Logger log = LoggerFactory.getLogger(DoctorCommand.class);

    private final StorageConfig storage;
    private final EmbeddingConfig embedding;

    public DoctorCommand(StorageConfig storage, EmbeddingConfig embedding) {
        this.storage = storage;
        this.embedding = embedding;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkDataDirectory());
        results.add(checkIndexDirectory());
        results.add(checkEmbeddingEndpoint());
        results.add(checkJavaVersion());
        var report = String.join("\n", results);
        log.debug("Doctor report:\n{}", report);
        return report;
    }

    private String checkDataDirectory() {
        Path dir = storage.dataDir();
        if (!Files.exists(dir)) {
            return "[WARN] Data directory " + dir + " not found (will be created on first open)";
        }
        if (!Files.isDirectory(dir)) {
            return "[FAIL] Data directory " + dir + " is not a directory";
        }
        return Files.isWritable(dir)
                ? "[OK] Data directory " + dir
                : "[FAIL] Data directory " + dir + " is not writable";
    }

    private String checkIndexDirectory() {
        return Files.isDirectory(storage.indexDir())
                ? "[OK] Lucene index directory exists"
                : "[WARN] Lucene index directory not found (will be created on first open)";
    }

    private String checkEmbeddingEndpoint() {
        if (!embedding.remote()) {
            return "[OK] Similarity keys: local hashing";
        }
        try {
            var client = HttpClient.newHttpClient();
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(embedding.baseUrl()))
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            var resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() < 500
                    ? "[OK] Embedding endpoint reachable"
                    : "[FAIL] Embedding endpoint: HTTP " + resp.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[FAIL] Embedding endpoint: interrupted";
        } catch (Exception e) {
            return "[FAIL] Embedding endpoint: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
