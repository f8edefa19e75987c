package com.memorygraph.index;

import com.memorygraph.shared.CancellationSignal;
import com.memorygraph.shared.StorageUnavailableException;
import com.memorygraph.shared.config.IndexConfig;
import com.memorygraph.shared.model.MemoryNode;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.MultiBits;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cosine k-NN index over similarity keys. Writes are committed immediately; searches run
 * against the latest refreshed point-in-time reader, so a concurrent write may or may not
 * be visible to a search already in flight.
 */
public class LuceneSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(LuceneSimilarityIndex.class);

    static final String FIELD_ID = "id";
    static final String FIELD_KEY = "key";
    static final String FIELD_TAG = "tag";
    static final String FIELD_IMPORTANCE = "importance";
    static final String FIELD_CREATED = "createdAt";

    private static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparing(Comparator.comparingDouble(SearchHit::importance).reversed())
            .thenComparing(SearchHit::createdAt, Comparator.reverseOrder());

    private final Directory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final int dimensions;
    private final int overfetch;

    public LuceneSimilarityIndex(Path indexPath, IndexConfig config) {
        this(openDirectory(indexPath), config);
    }

    public LuceneSimilarityIndex(Directory directory, IndexConfig config) {
        this.directory = directory;
        this.dimensions = config.dimensions();
        this.overfetch = Math.max(config.overfetch(), 1);
        try {
            var writerConfig = new IndexWriterConfig(new StandardAnalyzer());
            writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            this.writer = new IndexWriter(directory, writerConfig);
            this.searcherManager = new SearcherManager(writer, null);
        } catch (IOException e) {
            log.error("Failed to open similarity index", e);
            throw new StorageUnavailableException("Failed to open similarity index", e);
        }
    }

    private static Directory openDirectory(Path indexPath) {
        try {
            Files.createDirectories(indexPath);
            return FSDirectory.open(indexPath);
        } catch (IOException e) {
            log.error("Failed to open index directory {}", indexPath, e);
            throw new StorageUnavailableException("Failed to open index directory: " + indexPath, e);
        }
    }

    @Override
    public void index(MemoryNode node) {
        var key = node.similarityKey();
        checkKey(key);
        var doc = new Document();
        doc.add(new StringField(FIELD_ID, node.id(), Field.Store.YES));
        doc.add(new KnnFloatVectorField(FIELD_KEY, key, VectorSimilarityFunction.COSINE));
        for (var tag : node.tags()) {
            doc.add(new StringField(FIELD_TAG, tag, Field.Store.NO));
        }
        doc.add(new StoredField(FIELD_IMPORTANCE, node.importance()));
        doc.add(new StoredField(FIELD_CREATED, node.createdAt().toEpochMilli()));
        try {
            writer.updateDocument(new Term(FIELD_ID, node.id()), doc);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            log.error("Failed to index node {}", node.id(), e);
            throw new StorageUnavailableException("Failed to index node " + node.id(), e);
        }
    }

    @Override
    public void remove(String nodeId) {
        try {
            writer.deleteDocuments(new Term(FIELD_ID, nodeId));
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            log.error("Failed to remove node {} from index", nodeId, e);
            throw new StorageUnavailableException("Failed to remove node " + nodeId + " from index", e);
        }
    }

    @Override
    public List<SearchHit> search(SearchQuery query, CancellationSignal signal) {
        checkKey(query.key());
        if (query.k() <= 0) throw new IllegalArgumentException("k must be positive: " + query.k());
        signal.throwIfCancelled("search");

        try {
            var searcher = searcherManager.acquire();
            try {
                int maxDoc = searcher.getIndexReader().maxDoc();
                if (maxDoc == 0) return List.of();
                int candidates = Math.min(Math.max(query.k() * overfetch, 100), maxDoc);
                var knn = new KnnFloatVectorQuery(FIELD_KEY, query.key(), candidates, tagFilter(query.tags()));
                var top = searcher.search(knn, candidates);
                var storedFields = searcher.storedFields();

                var hits = new ArrayList<SearchHit>();
                for (var scoreDoc : top.scoreDocs) {
                    signal.throwIfCancelled("search");
                    if (scoreDoc.score < query.minScore()) continue;
                    var doc = storedFields.document(scoreDoc.doc);
                    hits.add(new SearchHit(
                            doc.get(FIELD_ID),
                            scoreDoc.score,
                            doc.getField(FIELD_IMPORTANCE).numericValue().doubleValue(),
                            Instant.ofEpochMilli(doc.getField(FIELD_CREATED).numericValue().longValue())));
                }
                hits.sort(RANKING);
                return hits.size() > query.k() ? List.copyOf(hits.subList(0, query.k())) : hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            log.error("Similarity search failed", e);
            throw new StorageUnavailableException("Similarity search failed", e);
        }
    }

    @Override
    public Set<String> indexedIds() {
        try {
            searcherManager.maybeRefreshBlocking();
            var searcher = searcherManager.acquire();
            try {
                var reader = searcher.getIndexReader();
                var liveDocs = MultiBits.getLiveDocs(reader);
                var storedFields = reader.storedFields();
                var ids = new HashSet<String>();
                for (int i = 0; i < reader.maxDoc(); i++) {
                    if (liveDocs != null && !liveDocs.get(i)) continue;
                    ids.add(storedFields.document(i).get(FIELD_ID));
                }
                return ids;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            log.error("Failed to list indexed ids", e);
            throw new StorageUnavailableException("Failed to list indexed ids", e);
        }
    }

    private Query tagFilter(Set<String> tags) {
        if (tags.isEmpty()) return null;
        var filter = new BooleanQuery.Builder();
        for (var tag : tags) {
            filter.add(new TermQuery(new Term(FIELD_TAG, tag)), BooleanClause.Occur.SHOULD);
        }
        return filter.build();
    }

    private void checkKey(float[] key) {
        if (key.length != dimensions) {
            throw new IllegalArgumentException(
                    "Key has " + key.length + " dimensions, index expects " + dimensions);
        }
        boolean nonZero = false;
        for (var v : key) {
            if (!Float.isFinite(v)) throw new IllegalArgumentException("Key contains a non-finite value");
            if (v != 0f) nonZero = true;
        }
        if (!nonZero) throw new IllegalArgumentException("Key must not be the zero vector");
    }

    @Override
    public void close() {
        try {
            searcherManager.close();
            writer.close();
            directory.close();
        } catch (IOException e) {
            log.error("Failed to close similarity index", e);
        }
    }
}
