package com.memorygraph.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.memorygraph.shared.StorageUnavailableException;
import com.memorygraph.shared.config.StorageConfig;
import com.memorygraph.shared.model.AccessGrant;
import com.memorygraph.shared.model.MemoryEdge;
import com.memorygraph.shared.model.MemoryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON document per record under {@code nodes/}, {@code grants/} and {@code edges/}.
 * Writes go to a temp file that is atomically moved over the target, so a crash
 * leaves either the old or the new document.
 */
public class FileNodeRepository implements NodeRepository {

    private static final Logger log = LoggerFactory.getLogger(FileNodeRepository.class);
    private static final String SUFFIX = ".json";

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path nodesDir;
    private final Path grantsDir;
    private final Path edgesDir;
    private final int retries;
    private final long retryDelayMs;

    public FileNodeRepository(StorageConfig config) {
        this.nodesDir = config.nodesDir();
        this.grantsDir = config.grantsDir();
        this.edgesDir = config.edgesDir();
        this.retries = config.retries();
        this.retryDelayMs = config.retryDelayMs();
        try {
            Files.createDirectories(nodesDir);
            Files.createDirectories(grantsDir);
            Files.createDirectories(edgesDir);
        } catch (IOException e) {
            log.error("Cannot create data directory {}", config.dataDir(), e);
            throw new StorageUnavailableException("Cannot create data directory: " + config.dataDir(), e);
        }
    }

    @Override
    public void saveNode(MemoryNode node) {
        write(nodesDir, node.id(), node.withParent(null));
    }

    @Override
    public void deleteNode(String nodeId) {
        delete(nodesDir, nodeId);
    }

    @Override
    public List<MemoryNode> loadNodes() {
        return readAll(nodesDir, MemoryNode.class);
    }

    @Override
    public void saveGrant(AccessGrant grant) {
        write(grantsDir, grant.id(), grant);
    }

    @Override
    public void deleteGrant(String grantId) {
        delete(grantsDir, grantId);
    }

    @Override
    public List<AccessGrant> loadGrants() {
        return readAll(grantsDir, AccessGrant.class);
    }

    @Override
    public void saveEdge(MemoryEdge edge) {
        write(edgesDir, edge.id(), edge);
    }

    @Override
    public void deleteEdge(String edgeId) {
        delete(edgesDir, edgeId);
    }

    @Override
    public List<MemoryEdge> loadEdges() {
        return readAll(edgesDir, MemoryEdge.class);
    }

    private void write(Path dir, String id, Object record) {
        var target = dir.resolve(id + SUFFIX);
        try {
            StorageRetry.execute("write " + target, () -> {
                var bytes = MAPPER.writeValueAsBytes(record);
                var tmp = Files.createTempFile(dir, id, ".tmp");
                try {
                    Files.write(tmp, bytes);
                    return Files.move(tmp, target,
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } finally {
                    Files.deleteIfExists(tmp);
                }
            }, retries, retryDelayMs);
        } catch (StorageUnavailableException e) {
            log.error("Failed to write {}", target, e);
            throw e;
        }
    }

    private void delete(Path dir, String id) {
        var target = dir.resolve(id + SUFFIX);
        try {
            StorageRetry.execute("delete " + target, () -> Files.deleteIfExists(target), retries, retryDelayMs);
        } catch (StorageUnavailableException e) {
            log.error("Failed to delete {}", target, e);
            throw e;
        }
    }

    private <T> List<T> readAll(Path dir, Class<T> type) {
        var files = StorageRetry.execute("list " + dir, () -> {
            try (var paths = Files.list(dir)) {
                return paths.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList();
            }
        }, retries, retryDelayMs);

        var records = new ArrayList<T>();
        for (var file : files) {
            try {
                records.add(MAPPER.readValue(file.toFile(), type));
            } catch (IOException e) {
                log.error("Skipping unreadable record {}", file, e);
            }
        }
        return records;
    }
}
