package de.mirkosertic.codeindex.store;

import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.PostingsEnum;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.FieldExistsQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lucene backed vector store. One Lucene document per chunk, with the embedding in a cosine
 * similarity {@link KnnFloatVectorField}.
 * <p>
 * Every write refreshes the {@link SearcherManager} before returning, so readers observe a
 * document's old chunk set or its new one. Commits happen periodically and on close. The model
 * that produced the stored vectors is kept in the commit user data.
 */
public class LuceneVectorStore implements VectorStore {

    private static final Logger logger = LoggerFactory.getLogger(LuceneVectorStore.class);

    static final String CHUNK_ID = "chunk_id";
    static final String DOCUMENT_ID = "document_id";
    static final String CHUNK_INDEX = "chunk_index";
    static final String SOURCE_PATH = "source_path";
    static final String TEXT = "text";
    static final String CONTENT_HASH = "content_hash";
    static final String VECTOR = "vector";
    static final String META_PREFIX = "meta.";

    static final String COMMIT_MODEL = "embedding_model";
    static final String COMMIT_DIMENSION = "embedding_dimension";

    private final Directory directory;
    private final IndexWriter indexWriter;
    private final SearcherManager searcherManager;
    private final @Nullable ScheduledExecutorService commitScheduler;
    private final Object writeLock = new Object();

    private volatile @Nullable String boundModel;
    private volatile int boundDimension;

    public LuceneVectorStore(final Directory directory, final Duration commitInterval) throws IOException {
        this.directory = directory;
        final IndexWriterConfig config = new IndexWriterConfig();
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(directory, config);
        this.indexWriter.commit();
        this.searcherManager = new SearcherManager(indexWriter, null);

        final Map<String, String> commitData = readCommitData();
        this.boundModel = commitData.get(COMMIT_MODEL);
        this.boundDimension = commitData.containsKey(COMMIT_DIMENSION)
                ? Integer.parseInt(commitData.get(COMMIT_DIMENSION)) : 0;

        if (commitInterval.isZero() || commitInterval.isNegative()) {
            this.commitScheduler = null;
        } else {
            this.commitScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "vector-store-commit");
                t.setDaemon(true);
                return t;
            });
            commitScheduler.scheduleWithFixedDelay(this::periodicCommit,
                    commitInterval.toMillis(), commitInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    public static LuceneVectorStore open(final Path path, final Duration commitInterval) throws IOException {
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            logger.info("Created vector store directory: {}", path.toAbsolutePath());
        }
        final LuceneVectorStore store = new LuceneVectorStore(FSDirectory.open(path), commitInterval);
        logger.info("Vector store opened at {} (model={})", path.toAbsolutePath(), store.boundModel);
        return store;
    }

    private Map<String, String> readCommitData() {
        final Map<String, String> data = new HashMap<>();
        final Iterable<Map.Entry<String, String>> live = indexWriter.getLiveCommitData();
        if (live != null) {
            for (final Map.Entry<String, String> entry : live) {
                data.put(entry.getKey(), entry.getValue());
            }
        }
        return data;
    }

    private void periodicCommit() {
        try {
            commit();
        } catch (final Exception e) {
            // Must catch all exceptions: ScheduledExecutorService silently cancels
            // the periodic task if the Runnable throws.
            logger.warn("Periodic vector store commit failed", e);
        }
    }

    @Override
    public void upsert(final StoredChunk chunk) throws IOException {
        synchronized (writeLock) {
            indexWriter.updateDocument(new Term(CHUNK_ID, chunk.chunkId()), toDocument(chunk));
            searcherManager.maybeRefreshBlocking();
        }
    }

    @Override
    public void replaceDocument(final String documentId, final List<StoredChunk> chunks) throws IOException {
        final List<Document> documents = new ArrayList<>(chunks.size());
        for (final StoredChunk chunk : chunks) {
            if (!chunk.documentId().equals(documentId)) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " does not belong to " + documentId);
            }
            documents.add(toDocument(chunk));
        }
        synchronized (writeLock) {
            final Term term = new Term(DOCUMENT_ID, documentId);
            if (documents.isEmpty()) {
                indexWriter.deleteDocuments(term);
            } else {
                indexWriter.updateDocuments(term, documents);
            }
            searcherManager.maybeRefreshBlocking();
        }
    }

    @Override
    public long deleteByDocument(final String documentId) throws IOException {
        synchronized (writeLock) {
            final TermQuery query = new TermQuery(new Term(DOCUMENT_ID, documentId));
            final long existing;
            final IndexSearcher searcher = searcherManager.acquire();
            try {
                existing = searcher.count(query);
            } finally {
                searcherManager.release(searcher);
            }
            if (existing == 0) {
                return 0;
            }
            indexWriter.deleteDocuments(query);
            searcherManager.maybeRefreshBlocking();
            return existing;
        }
    }

    @Override
    public List<VectorMatch> search(final float[] vector, final int topK) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int numDocs = searcher.getIndexReader().numDocs();
            if (numDocs == 0) {
                return List.of();
            }
            final int k = Math.min(topK, numDocs);
            final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(VECTOR, vector, k), k);
            final StoredFields storedFields = searcher.storedFields();
            final List<VectorMatch> matches = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = storedFields.document(scoreDoc.doc);
                matches.add(new VectorMatch(
                        doc.get(CHUNK_ID),
                        doc.get(DOCUMENT_ID),
                        doc.getField(CHUNK_INDEX).numericValue().intValue(),
                        doc.get(SOURCE_PATH),
                        doc.get(TEXT),
                        toCosine(scoreDoc.score),
                        readMetadata(doc)));
            }
            matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed());
            return matches;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Lucene maps cosine similarity to (1 + cos) / 2 so that scores are non-negative.
     */
    static double toCosine(final float luceneScore) {
        return 2.0 * luceneScore - 1.0;
    }

    @Override
    public StoreStats stats() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final IndexReader reader = searcher.getIndexReader();
            return new StoreStats(
                    collectDocumentIds(reader).size(),
                    reader.numDocs(),
                    searcher.count(new FieldExistsQuery(VECTOR)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public Set<String> documentIds() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return collectDocumentIds(searcher.getIndexReader());
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Deleted documents keep their terms until segments merge, so postings are checked against
     * the live docs.
     */
    private static Set<String> collectDocumentIds(final IndexReader reader) throws IOException {
        final Set<String> ids = new TreeSet<>();
        for (final LeafReaderContext context : reader.leaves()) {
            final LeafReader leaf = context.reader();
            final Terms terms = leaf.terms(DOCUMENT_ID);
            if (terms == null) {
                continue;
            }
            final Bits liveDocs = leaf.getLiveDocs();
            final TermsEnum termsEnum = terms.iterator();
            PostingsEnum postings = null;
            BytesRef term;
            while ((term = termsEnum.next()) != null) {
                postings = termsEnum.postings(postings, PostingsEnum.NONE);
                int doc;
                while ((doc = postings.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
                    if (liveDocs == null || liveDocs.get(doc)) {
                        ids.add(term.utf8ToString());
                        break;
                    }
                }
            }
        }
        return ids;
    }

    @Override
    public Optional<String> contentHash(final String documentId) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(new TermQuery(new Term(DOCUMENT_ID, documentId)), 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            final Document doc = searcher.storedFields().document(topDocs.scoreDocs[0].doc);
            return Optional.ofNullable(doc.get(CONTENT_HASH));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public Optional<String> embeddingModel() {
        return Optional.ofNullable(boundModel);
    }

    @Override
    public OptionalInt embeddingDimension() {
        return boundDimension > 0 ? OptionalInt.of(boundDimension) : OptionalInt.empty();
    }

    @Override
    public void bindEmbeddingModel(final String modelId, final int dimension) throws IOException {
        if (modelId.equals(boundModel) && dimension == boundDimension) {
            return;
        }
        synchronized (writeLock) {
            final String current = boundModel;
            if (current != null && (!current.equals(modelId) || boundDimension != dimension)) {
                if (stats().embeddedCount() > 0) {
                    throw new EmbeddingModelMismatchException(current + "/" + boundDimension, modelId + "/" + dimension);
                }
                logger.info("Rebinding empty vector store from model {} to {}", current, modelId);
            }
            indexWriter.setLiveCommitData(Map.of(
                    COMMIT_MODEL, modelId,
                    COMMIT_DIMENSION, Integer.toString(dimension)).entrySet());
            indexWriter.commit();
            boundModel = modelId;
            boundDimension = dimension;
        }
    }

    @Override
    public void clear() throws IOException {
        synchronized (writeLock) {
            indexWriter.deleteAll();
            indexWriter.commit();
            searcherManager.maybeRefreshBlocking();
        }
        logger.info("Vector store cleared");
    }

    @Override
    public void commit() throws IOException {
        synchronized (writeLock) {
            if (indexWriter.hasUncommittedChanges()) {
                indexWriter.commit();
            }
        }
    }

    private static Document toDocument(final StoredChunk chunk) {
        final Document doc = new Document();
        doc.add(new StringField(CHUNK_ID, chunk.chunkId(), Field.Store.YES));
        doc.add(new StringField(DOCUMENT_ID, chunk.documentId(), Field.Store.YES));
        doc.add(new StoredField(CHUNK_INDEX, chunk.chunkIndex()));
        doc.add(new StoredField(SOURCE_PATH, chunk.sourcePath()));
        doc.add(new StoredField(TEXT, chunk.text()));
        if (chunk.contentHash() != null) {
            doc.add(new StoredField(CONTENT_HASH, chunk.contentHash()));
        }
        doc.add(new KnnFloatVectorField(VECTOR, chunk.vector(), VectorSimilarityFunction.COSINE));
        for (final Map.Entry<String, String> entry : chunk.metadata().entrySet()) {
            doc.add(new StoredField(META_PREFIX + entry.getKey(), entry.getValue()));
        }
        return doc;
    }

    private static Map<String, String> readMetadata(final Document doc) {
        final Map<String, String> metadata = new HashMap<>();
        for (final IndexableField field : doc.getFields()) {
            if (field.name().startsWith(META_PREFIX) && field.stringValue() != null) {
                metadata.put(field.name().substring(META_PREFIX.length()), field.stringValue());
            }
        }
        return metadata;
    }

    @Override
    public void close() throws IOException {
        if (commitScheduler != null) {
            commitScheduler.shutdown();
            try {
                if (!commitScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    commitScheduler.shutdownNow();
                }
            } catch (final InterruptedException e) {
                commitScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // Close SearcherManager before IndexWriter
        searcherManager.close();
        indexWriter.close();
        directory.close();
        logger.info("Vector store closed");
    }
}
