package de.mirkosertic.codeindex;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import de.mirkosertic.codeindex.bulk.BulkIndexer;
import de.mirkosertic.codeindex.bulk.BulkProgress;
import de.mirkosertic.codeindex.bulk.BulkProgressListener;
import de.mirkosertic.codeindex.bulk.BulkStartResult;
import de.mirkosertic.codeindex.bulk.BulkStateStore;
import de.mirkosertic.codeindex.config.ApplicationConfig;
import de.mirkosertic.codeindex.config.BulkConfig;
import de.mirkosertic.codeindex.config.EmbeddingConfig;
import de.mirkosertic.codeindex.config.WatchConfig;
import de.mirkosertic.codeindex.document.Chunker;
import de.mirkosertic.codeindex.document.DocumentBuilder;
import de.mirkosertic.codeindex.document.DocumentIdResolver;
import de.mirkosertic.codeindex.document.SourceDocument;
import de.mirkosertic.codeindex.embedding.CachingEmbeddingBackend;
import de.mirkosertic.codeindex.embedding.EmbeddingBackend;
import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import de.mirkosertic.codeindex.embedding.HashingEmbeddingBackend;
import de.mirkosertic.codeindex.embedding.OllamaEmbeddingBackend;
import de.mirkosertic.codeindex.ingest.BatchResult;
import de.mirkosertic.codeindex.ingest.DocumentWriteLock;
import de.mirkosertic.codeindex.ingest.IndexingStatsTracker;
import de.mirkosertic.codeindex.ingest.IngestProgressListener;
import de.mirkosertic.codeindex.ingest.IngestSummary;
import de.mirkosertic.codeindex.ingest.IngestionPipeline;
import de.mirkosertic.codeindex.ingest.RemovalService;
import de.mirkosertic.codeindex.query.QueryService;
import de.mirkosertic.codeindex.query.SearchResponse;
import de.mirkosertic.codeindex.store.LuceneVectorStore;
import de.mirkosertic.codeindex.store.VectorStore;
import de.mirkosertic.codeindex.watch.ChangeFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * The operations offered to callers: bulk indexing, ingestion, search, status and watch control.
 * <p>
 * Owns every component it is given and closes them in reverse order of construction.
 */
public class CodeIndexService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexService.class);

    private final WatchConfig watchConfig;
    private final VectorStore store;
    private final EmbeddingBackend indexingBackend;
    private final EmbeddingBackend queryBackend;
    private final IndexingStatsTracker stats;
    private final IngestionPipeline pipeline;
    private final ContinuousIndexer continuousIndexer;
    private final BulkIndexer bulkIndexer;
    private final QueryService queryService;

    public CodeIndexService(final WatchConfig watchConfig,
                            final VectorStore store,
                            final EmbeddingBackend indexingBackend,
                            final EmbeddingBackend queryBackend,
                            final IndexingStatsTracker stats,
                            final IngestionPipeline pipeline,
                            final ContinuousIndexer continuousIndexer,
                            final BulkIndexer bulkIndexer,
                            final QueryService queryService) {
        this.watchConfig = watchConfig;
        this.store = store;
        this.indexingBackend = indexingBackend;
        this.queryBackend = queryBackend;
        this.stats = stats;
        this.pipeline = pipeline;
        this.continuousIndexer = continuousIndexer;
        this.bulkIndexer = bulkIndexer;
        this.queryService = queryService;
    }

    /**
     * Builds the complete service graph from configuration.
     *
     * @throws de.mirkosertic.codeindex.config.ConfigurationException if the configuration is invalid
     * @throws IOException if the vector store cannot be opened
     */
    public static CodeIndexService create(final ApplicationConfig config) throws IOException {
        final WatchConfig watchConfig = config.toWatchConfig();
        final BulkConfig bulkConfig = config.toBulkConfig();
        final EmbeddingConfig embeddingConfig = config.toEmbeddingConfig();

        final EmbeddingBackend backend = createBackend(embeddingConfig);
        final EmbeddingBackend queryBackend = embeddingConfig.cacheSize() > 0
                ? new CachingEmbeddingBackend(backend, embeddingConfig.cacheSize())
                : backend;

        final VectorStore store = LuceneVectorStore.open(Paths.get(config.getIndexPath()), config.getCommitInterval());

        final Clock clock = Clock.systemUTC();
        final ChangeFilter filter = new ChangeFilter(watchConfig);
        final DocumentIdResolver idResolver = new DocumentIdResolver(watchConfig.root());
        final DocumentBuilder documentBuilder = new DocumentBuilder(filter, idResolver, clock);
        final IndexingStatsTracker stats = new IndexingStatsTracker();
        final DocumentWriteLock writeLock = new DocumentWriteLock();
        final IngestionPipeline pipeline = new IngestionPipeline(backend, store,
                new Chunker(config.toChunkingConfig()), config.toIngestConfig(), stats, writeLock);
        final RemovalService removalService = new RemovalService(store, idResolver, stats, writeLock);

        final ContinuousIndexer continuousIndexer = new ContinuousIndexer(watchConfig, filter, documentBuilder,
                pipeline, removalService, stats);
        final BulkIndexer bulkIndexer = new BulkIndexer(filter, idResolver, documentBuilder, pipeline, store,
                new BulkStateStore(bulkConfig.stateFile()), bulkConfig.batchSize(), clock);
        final QueryService queryService = new QueryService(queryBackend, store);

        return new CodeIndexService(watchConfig, store, backend, queryBackend, stats, pipeline, continuousIndexer,
                bulkIndexer, queryService);
    }

    static EmbeddingBackend createBackend(final EmbeddingConfig config) {
        return switch (config.provider()) {
            case "hashing" -> new HashingEmbeddingBackend(config.dimension());
            case "ollama" -> new OllamaEmbeddingBackend(OllamaEmbeddingBackend.defaultClient(config.timeout()),
                    config.url(), config.model(), config.dimension());
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.provider());
        };
    }

    /**
     * @throws EmbeddingModelMismatchException if the store holds vectors of another model
     */
    public void verifyEmbeddingModel() {
        final Optional<String> storeModel = store.embeddingModel();
        if (storeModel.isPresent() && !storeModel.get().equals(indexingBackend.modelId())) {
            throw new EmbeddingModelMismatchException(storeModel.get(), indexingBackend.modelId());
        }
    }

    // ==================== Bulk indexing ====================

    public BulkStartResult startBulkIndex(final boolean force) throws IOException {
        return bulkIndexer.start(force);
    }

    public BulkProgress getBulkProgress() {
        return bulkIndexer.getProgress();
    }

    public boolean stopBulkIndex() {
        return bulkIndexer.stop();
    }

    public void addBulkProgressListener(final BulkProgressListener listener) {
        bulkIndexer.addListener(listener);
    }

    BulkIndexer getBulkIndexer() {
        return bulkIndexer;
    }

    // ==================== Ingestion and search ====================

    /**
     * Ingests already built documents in batches of the configured watch batch size.
     */
    public IngestSummary ingest(final List<SourceDocument> documents, final IngestProgressListener listener) {
        return pipeline.ingest(documents, watchConfig.batchSize(), listener);
    }

    public SearchResponse search(final String query, final int topK, final double threshold) throws IOException {
        return queryService.search(query, topK, threshold);
    }

    public BatchResult reindex(final Path path) {
        return continuousIndexer.reindex(path);
    }

    // ==================== Watching ====================

    public boolean startWatching() {
        return continuousIndexer.start();
    }

    public void stopWatching() {
        continuousIndexer.stop();
    }

    public IndexingStatus getStats() throws IOException {
        long hits = 0;
        long misses = 0;
        if (queryBackend instanceof CachingEmbeddingBackend caching) {
            final CacheStats cacheStats = caching.stats();
            hits = cacheStats.hitCount();
            misses = cacheStats.missCount();
        }
        return new IndexingStatus(
                stats.getStatistics(),
                store.stats(),
                bulkIndexer.getProgress(),
                continuousIndexer.isWatching(),
                continuousIndexer.activeSourceName(),
                indexingBackend.modelId(),
                store.embeddingModel().orElse(null),
                hits,
                misses);
    }

    @Override
    public void close() {
        logger.info("Shutting down code index service...");

        try {
            bulkIndexer.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down bulk indexer", e);
        }

        try {
            continuousIndexer.stop();
        } catch (final Exception e) {
            logger.error("Error stopping continuous indexer", e);
        }

        try {
            stats.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down statistics tracker", e);
        }

        try {
            pipeline.close();
        } catch (final Exception e) {
            logger.error("Error shutting down ingestion pipeline", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing vector store", e);
        }

        logger.info("Code index service shutdown complete");
    }
}
