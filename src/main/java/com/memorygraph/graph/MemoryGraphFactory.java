package com.memorygraph.graph;

import com.memorygraph.consent.ConsentEngine;
import com.memorygraph.consent.GrantTable;
import com.memorygraph.hierarchy.HierarchyAggregator;
import com.memorygraph.hierarchy.Summarizer;
import com.memorygraph.hierarchy.TruncatingSummarizer;
import com.memorygraph.index.EmbeddingService;
import com.memorygraph.index.HashingKeyFunction;
import com.memorygraph.index.LuceneSimilarityIndex;
import com.memorygraph.index.SimilarityIndex;
import com.memorygraph.index.SimilarityKeyFunction;
import com.memorygraph.observability.GraphMetrics;
import com.memorygraph.shared.config.GraphConfig;
import com.memorygraph.store.FileNodeRepository;
import com.memorygraph.store.InMemoryNodeRepository;
import com.memorygraph.store.NodeRepository;
import com.memorygraph.store.NodeStore;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class MemoryGraphFactory {

    private static final Logger log = LoggerFactory.getLogger(MemoryGraphFactory.class);

    private MemoryGraphFactory() {}

    public static MemoryGraph open(GraphConfig config) {
        return open(config, Clock.systemUTC());
    }

    public static MemoryGraph open(GraphConfig config, Clock clock) {
        return open(config, clock, new TruncatingSummarizer(config.rollup().maxSummaryChars()));
    }

    /** Durable graph under {@code config.storage().dataDir()}. */
    public static MemoryGraph open(GraphConfig config, Clock clock, Summarizer summarizer) {
        log.info("Opening memory graph at {}", config.storage().dataDir());
        var repository = new FileNodeRepository(config.storage());
        var index = new LuceneSimilarityIndex(config.storage().indexDir(), config.index());
        return wire(config, clock, summarizer, repository, index);
    }

    /** Graph that keeps nothing beyond the life of the process. */
    public static MemoryGraph inMemory(GraphConfig config, Clock clock, Summarizer summarizer) {
        var index = new LuceneSimilarityIndex(new ByteBuffersDirectory(), config.index());
        return wire(config, clock, summarizer, new InMemoryNodeRepository(), index);
    }

    private static MemoryGraph wire(GraphConfig config, Clock clock, Summarizer summarizer,
                                    NodeRepository repository, SimilarityIndex index) {
        var keyFunction = keyFunction(config);
        var store = new NodeStore(repository, config.ttl(), clock);
        var grants = new GrantTable(repository);
        var consent = new ConsentEngine(grants, clock);
        var aggregator = new HierarchyAggregator(store, keyFunction, summarizer, config.rollup());
        return new MemoryGraph(store, grants, consent, index, keyFunction, aggregator, new GraphMetrics(), clock);
    }

    static SimilarityKeyFunction keyFunction(GraphConfig config) {
        int dimensions = config.index().dimensions();
        if (config.embedding().remote()) {
            log.info("Similarity keys from {} ({})", config.embedding().baseUrl(), config.embedding().model());
            return new EmbeddingService(config.embedding(), dimensions);
        }
        return new HashingKeyFunction(dimensions);
    }
}
