package de.mirkosertic.codeindex;

import de.mirkosertic.codeindex.config.WatchConfig;
import de.mirkosertic.codeindex.document.DocumentBuilder;
import de.mirkosertic.codeindex.document.SourceDocument;
import de.mirkosertic.codeindex.ingest.BatchResult;
import de.mirkosertic.codeindex.ingest.IndexingStatsTracker;
import de.mirkosertic.codeindex.ingest.IngestionPipeline;
import de.mirkosertic.codeindex.ingest.RemovalService;
import de.mirkosertic.codeindex.queue.BatchHandler;
import de.mirkosertic.codeindex.queue.BatchScheduler;
import de.mirkosertic.codeindex.queue.IndexingQueue;
import de.mirkosertic.codeindex.watch.ChangeDebouncer;
import de.mirkosertic.codeindex.watch.ChangeFilter;
import de.mirkosertic.codeindex.watch.ChangeSource;
import de.mirkosertic.codeindex.watch.FileWatcherService;
import de.mirkosertic.codeindex.watch.NativeChangeSource;
import de.mirkosertic.codeindex.watch.PollingChangeSource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the vector store in sync with the watched tree: change events are debounced into the
 * indexing queue, drained in batches and fed through the ingestion pipeline. Deletions bypass the
 * queue and go straight to the {@link RemovalService}.
 */
public class ContinuousIndexer implements BatchHandler {

    private static final Logger logger = LoggerFactory.getLogger(ContinuousIndexer.class);

    private static final Duration NATIVE_POLL_TIMEOUT = Duration.ofSeconds(1);

    private final WatchConfig config;
    private final DocumentBuilder documentBuilder;
    private final IngestionPipeline pipeline;
    private final RemovalService removalService;
    private final IndexingStatsTracker stats;
    private final IndexingQueue queue;
    private final ChangeDebouncer debouncer;
    private final FileWatcherService watcher;
    private final BatchScheduler scheduler;

    private volatile boolean started;

    public ContinuousIndexer(final WatchConfig config,
                             final ChangeFilter filter,
                             final DocumentBuilder documentBuilder,
                             final IngestionPipeline pipeline,
                             final RemovalService removalService,
                             final IndexingStatsTracker stats) {
        this(config, filter, documentBuilder, pipeline, removalService, stats,
                new NativeChangeSource(NATIVE_POLL_TIMEOUT, filter::shouldDescend),
                config.pollingFallback() ? new PollingChangeSource(config.pollInterval(), filter::shouldDescend) : null,
                Clock.systemUTC());
    }

    ContinuousIndexer(final WatchConfig config,
                      final ChangeFilter filter,
                      final DocumentBuilder documentBuilder,
                      final IngestionPipeline pipeline,
                      final RemovalService removalService,
                      final IndexingStatsTracker stats,
                      final ChangeSource primary,
                      final @Nullable ChangeSource fallback,
                      final Clock clock) {
        this.config = config;
        this.documentBuilder = documentBuilder;
        this.pipeline = pipeline;
        this.removalService = removalService;
        this.stats = stats;
        this.queue = new IndexingQueue(config.maxQueueSize());
        stats.attachQueue(queue);
        this.debouncer = new ChangeDebouncer(config.debounce(), queue::offer, clock);
        this.watcher = new FileWatcherService(filter, primary, fallback, debouncer, removalService::remove);
        // Paths arriving within one debounce interval of the first are indexed together
        this.scheduler = new BatchScheduler(queue, config.batchSize(), config.debounce(), this);
    }

    /**
     * Starts the scheduler and the watcher. Does nothing when watching is disabled.
     *
     * @return true if live change notifications are active
     */
    public synchronized boolean start() {
        if (!config.enabled()) {
            logger.info("File watching is disabled");
            return false;
        }
        if (started) {
            return watcher.isWatching();
        }
        scheduler.start();
        final boolean watching = watcher.start();
        stats.startPeriodicLogging(config.statsInterval());
        started = true;
        logger.info("Continuous indexing started for {} (source={})", config.root(), watcher.activeSourceName());
        return watching;
    }

    /**
     * Stops the watcher first so no new work arrives, then the scheduler. Paths still queued are
     * discarded; they are picked up again by the next bulk run.
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        watcher.stop();
        scheduler.stop();
        started = false;
        logger.info("Continuous indexing stopped, {} queued paths discarded", queue.size());
    }

    @Override
    public void handle(final List<Path> paths, final int batchNumber) {
        final List<SourceDocument> documents = new ArrayList<>(paths.size());
        for (final Path path : paths) {
            final Optional<SourceDocument> document = documentBuilder.build(path);
            if (document.isPresent()) {
                documents.add(document.get());
            } else {
                logger.debug("Batch {}: skipping {}", batchNumber, path);
            }
        }
        if (documents.isEmpty()) {
            return;
        }
        pipeline.process(documents, batchNumber);
    }

    /**
     * Re-indexes one file right away, bypassing the queue and the unchanged-content check.
     * A path that no longer exists is removed from the store instead.
     */
    public BatchResult reindex(final Path path) {
        if (!Files.exists(path)) {
            removalService.remove(path);
            return BatchResult.empty(0);
        }
        final Optional<SourceDocument> document = documentBuilder.build(path);
        if (document.isEmpty()) {
            logger.info("Not re-indexing {}: not eligible or empty", path);
            return BatchResult.empty(0);
        }
        return pipeline.process(List.of(document.get()), 0, false);
    }

    public boolean isWatching() {
        return watcher.isWatching();
    }

    public @Nullable String activeSourceName() {
        return watcher.activeSourceName();
    }

    IndexingQueue getQueue() {
        return queue;
    }

    ChangeDebouncer getDebouncer() {
        return debouncer;
    }

    BatchScheduler getScheduler() {
        return scheduler;
    }
}
