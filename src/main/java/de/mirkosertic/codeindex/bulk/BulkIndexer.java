package de.mirkosertic.codeindex.bulk;

import de.mirkosertic.codeindex.document.DocumentBuilder;
import de.mirkosertic.codeindex.document.DocumentIdResolver;
import de.mirkosertic.codeindex.document.SourceDocument;
import de.mirkosertic.codeindex.ingest.BatchResult;
import de.mirkosertic.codeindex.ingest.ChunkFailure;
import de.mirkosertic.codeindex.ingest.IngestionPipeline;
import de.mirkosertic.codeindex.store.StoreStats;
import de.mirkosertic.codeindex.store.VectorStore;
import de.mirkosertic.codeindex.watch.ChangeFilter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-time crawl of the watched root that feeds every eligible file through the ingestion pipeline.
 * <p>
 * A run walks the tree ({@code DISCOVERING}), then indexes the files in batches ({@code INDEXING})
 * and ends in {@code COMPLETED} or {@code FAILED}. Only one run can be active. A populated store is
 * never re-indexed implicitly: without {@code force} the run is skipped, unless the persisted state
 * shows that the previous run did not finish, in which case the files already stored completely are
 * skipped and the rest are indexed. Stored documents whose files no longer exist are removed before
 * indexing starts.
 * <p>
 * {@link #stop()} is cooperative and checked between batches.
 */
public class BulkIndexer {

    private static final Logger logger = LoggerFactory.getLogger(BulkIndexer.class);

    static final int MAX_ERRORS = 100;

    private final ChangeFilter filter;
    private final DocumentIdResolver idResolver;
    private final DocumentBuilder documentBuilder;
    private final IngestionPipeline pipeline;
    private final VectorStore store;
    private final BulkStateStore stateStore;
    private final int batchSize;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<BulkProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Object progressLock = new Object();

    private volatile boolean stopRequested;
    private volatile @Nullable Thread runner;
    private volatile BulkProgress snapshot = BulkProgress.idle();

    // Guarded by progressLock
    private BulkStatus status = BulkStatus.IDLE;
    private int totalFiles;
    private int processedFiles;
    private int failedFiles;
    private int skippedFiles;
    private int currentBatch;
    private int totalBatches;
    private @Nullable Instant startTime;
    private @Nullable Instant estimatedCompletion;
    private @Nullable String currentFile;
    private boolean stopped;
    private final Deque<BulkError> errors = new ArrayDeque<>();
    private @Nullable String message;

    public BulkIndexer(final ChangeFilter filter,
                       final DocumentIdResolver idResolver,
                       final DocumentBuilder documentBuilder,
                       final IngestionPipeline pipeline,
                       final VectorStore store,
                       final BulkStateStore stateStore,
                       final int batchSize,
                       final Clock clock) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.filter = filter;
        this.idResolver = idResolver;
        this.documentBuilder = documentBuilder;
        this.pipeline = pipeline;
        this.store = store;
        this.stateStore = stateStore;
        this.batchSize = batchSize;
        this.clock = clock;
    }

    public void addListener(final BulkProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final BulkProgressListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a run on the {@code bulk-indexer} thread.
     *
     * @param force clear the store and index everything, even if it is populated
     * @throws BulkIndexAlreadyRunningException if a run is active
     * @throws IOException if the store cannot be inspected
     */
    public BulkStartResult start(final boolean force) throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new BulkIndexAlreadyRunningException(getProgress().status());
        }

        final boolean resume;
        try {
            final BulkState previous = stateStore.load();
            resume = !force && previous != null && previous.isUnfinished();
            if (!force && !resume) {
                final StoreStats stats = store.stats();
                if (!stats.isEmpty()) {
                    running.set(false);
                    final String reason = "Vector store already holds " + stats.documentCount() + " documents ("
                            + stats.chunkCount() + " chunks); start with force to re-index";
                    logger.info("Bulk indexing skipped: {}", reason);
                    return BulkStartResult.skipped(reason);
                }
            }
        } catch (final IOException | RuntimeException e) {
            running.set(false);
            throw e;
        }

        stopRequested = false;
        synchronized (progressLock) {
            resetProgress();
            transition(BulkStatus.DISCOVERING);
            startTime = clock.instant();
        }
        publish();

        final Thread thread = new Thread(() -> run(force, resume), "bulk-indexer");
        thread.setDaemon(true);
        runner = thread;
        thread.start();

        final String reason = force ? "Full re-index of " + filter.getRoot()
                : resume ? "Resuming unfinished run over " + filter.getRoot()
                : "Initial index of " + filter.getRoot();
        logger.info("Bulk indexing started: {}", reason);
        return BulkStartResult.started(reason);
    }

    /**
     * Requests a cooperative stop. The batch in progress completes first.
     *
     * @return true if a run was active
     */
    public boolean stop() {
        if (!running.get()) {
            return false;
        }
        stopRequested = true;
        synchronized (progressLock) {
            if (status == BulkStatus.INDEXING) {
                transition(BulkStatus.STOPPING);
                message = "Stop requested, finishing current batch";
            }
        }
        publish();
        logger.info("Bulk indexing stop requested");
        return true;
    }

    public BulkProgress getProgress() {
        return snapshot;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Waits for the active run, if any, to end.
     *
     * @return true if no run is active afterwards
     */
    public boolean awaitCompletion(final Duration timeout) throws InterruptedException {
        final Thread thread = runner;
        if (thread != null) {
            thread.join(timeout.toMillis());
        }
        return !running.get();
    }

    /**
     * Stops an active run and waits briefly for it to end. Called on application shutdown.
     */
    public void shutdown() {
        if (stop()) {
            try {
                if (!awaitCompletion(Duration.ofSeconds(30))) {
                    logger.warn("Bulk indexer did not finish its current batch in time");
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void run(final boolean force, final boolean resume) {
        try {
            if (force) {
                logger.info("Clearing vector store before full re-index");
                store.clear();
            }

            final List<Path> discovered = discover();
            final int orphans = force ? 0 : removeOrphans(discovered);
            final List<Path> files;
            int alreadyStored = 0;
            if (resume) {
                files = new ArrayList<>(discovered.size());
                for (final Path file : discovered) {
                    // Documents stored without content hash are incomplete and are indexed again
                    if (store.contentHash(idResolver.documentId(file)).isPresent()) {
                        alreadyStored++;
                    } else {
                        files.add(file);
                    }
                }
                logger.info("Resuming bulk run: {} files already stored, {} remaining", alreadyStored, files.size());
            } else {
                files = discovered;
            }

            synchronized (progressLock) {
                totalFiles = files.size();
                skippedFiles = alreadyStored;
                totalBatches = (files.size() + batchSize - 1) / batchSize;
                transition(BulkStatus.INDEXING);
            }
            persistState();
            publish();
            logger.info("Discovered {} files to index in {} batches", files.size(), getProgress().totalBatches());

            int batchNumber = 0;
            for (int from = 0; from < files.size(); from += batchSize) {
                if (stopRequested) {
                    logger.info("Bulk indexing stopped after {} of {} batches", batchNumber, getProgress().totalBatches());
                    break;
                }
                batchNumber++;
                final List<Path> batch = files.subList(from, Math.min(files.size(), from + batchSize));
                processBatch(batch, batchNumber);
            }

            synchronized (progressLock) {
                stopped = stopRequested;
                currentFile = null;
                estimatedCompletion = null;
                message = (stopped ? "Stopped: " : "Completed: ") + processedFiles + " of " + totalFiles
                        + " files processed, " + failedFiles + " failed"
                        + (orphans > 0 ? ", " + orphans + " orphaned documents removed" : "");
                transition(BulkStatus.COMPLETED);
            }
            logger.info("Bulk indexing finished. {}", getProgress().message());
        } catch (final IOException | RuntimeException e) {
            logger.error("Bulk indexing failed", e);
            synchronized (progressLock) {
                message = "Failed: " + e.getMessage();
                currentFile = null;
                estimatedCompletion = null;
                transition(BulkStatus.FAILED);
            }
        } finally {
            persistState();
            running.set(false);
            publish();
        }
    }

    private void processBatch(final List<Path> batch, final int batchNumber) {
        synchronized (progressLock) {
            currentBatch = batchNumber;
            currentFile = idResolver.documentId(batch.get(0));
        }
        publish();

        final List<SourceDocument> documents = new ArrayList<>(batch.size());
        int unreadable = 0;
        for (final Path file : batch) {
            final Optional<SourceDocument> document = documentBuilder.build(file);
            if (document.isPresent()) {
                documents.add(document.get());
            } else {
                // Vanished, shrank to empty or became ineligible since discovery
                unreadable++;
            }
        }

        final BatchResult result = pipeline.process(documents, batchNumber);

        final Set<String> failedDocuments = new LinkedHashSet<>();
        for (final ChunkFailure failure : result.failures()) {
            failedDocuments.add(failure.documentId());
        }

        synchronized (progressLock) {
            processedFiles += batch.size();
            failedFiles += result.documentsFailed();
            skippedFiles += unreadable + result.documentsSkipped();
            for (final ChunkFailure failure : result.failures()) {
                if (failedDocuments.remove(failure.documentId())) {
                    addError(new BulkError(failure.documentId(), failure.message(), batchNumber));
                }
            }
            estimatedCompletion = estimateCompletion();
        }
        persistState();
        publish();
    }

    /**
     * Deletes stored documents whose files were not discovered, for example files removed while
     * the watcher was not running.
     *
     * @return number of documents removed
     */
    private int removeOrphans(final List<Path> discovered) throws IOException {
        final Set<String> discoveredIds = new HashSet<>();
        for (final Path file : discovered) {
            discoveredIds.add(idResolver.documentId(file));
        }
        int removed = 0;
        for (final String documentId : store.documentIds()) {
            if (!discoveredIds.contains(documentId)) {
                store.deleteByDocument(documentId);
                removed++;
                logger.debug("Removed orphaned document {}", documentId);
            }
        }
        if (removed > 0) {
            logger.info("Removed {} stored documents without a file under {}", removed, filter.getRoot());
        }
        return removed;
    }

    private List<Path> discover() throws IOException {
        final Path root = filter.getRoot();
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "watch root is not a directory");
        }
        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                if (!dir.equals(root) && !filter.shouldDescend(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (filter.shouldInclude(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.warn("Cannot read {} during discovery: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    // Must hold progressLock
    private @Nullable Instant estimateCompletion() {
        if (startTime == null || processedFiles == 0) {
            return null;
        }
        final Instant now = clock.instant();
        final long elapsedMs = Math.max(1, Duration.between(startTime, now).toMillis());
        final double filesPerMs = (double) processedFiles / elapsedMs;
        final int remaining = totalFiles - processedFiles;
        return now.plusMillis(Math.round(remaining / filesPerMs));
    }

    // Must hold progressLock
    private void transition(final BulkStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal bulk status transition " + status + " -> " + next);
        }
        status = next;
    }

    // Must hold progressLock
    private void resetProgress() {
        totalFiles = 0;
        processedFiles = 0;
        failedFiles = 0;
        skippedFiles = 0;
        currentBatch = 0;
        totalBatches = 0;
        startTime = null;
        estimatedCompletion = null;
        currentFile = null;
        stopped = false;
        errors.clear();
        message = null;
    }

    // Must hold progressLock
    private void addError(final BulkError error) {
        errors.addLast(error);
        while (errors.size() > MAX_ERRORS) {
            errors.removeFirst();
        }
    }

    private void persistState() {
        final BulkProgress progress = takeSnapshot();
        final long startedAt = progress.startTime() != null ? progress.startTime().toEpochMilli() : 0L;
        try {
            stateStore.save(new BulkState(progress.status(), progress.stopped(), startedAt,
                    clock.millis(), progress.totalFiles(), progress.processedFiles(), progress.failedFiles()));
        } catch (final IOException e) {
            logger.warn("Failed to persist bulk state to {}", stateStore.getStatePath(), e);
        }
    }

    private BulkProgress takeSnapshot() {
        synchronized (progressLock) {
            return new BulkProgress(status, totalFiles, processedFiles, failedFiles, skippedFiles, currentBatch,
                    totalBatches, startTime, estimatedCompletion, currentFile, stopped, List.copyOf(errors), message);
        }
    }

    private void publish() {
        final BulkProgress progress;
        synchronized (progressLock) {
            progress = takeSnapshot();
            snapshot = progress;
        }
        for (final BulkProgressListener listener : listeners) {
            try {
                listener.onProgress(progress);
            } catch (final RuntimeException e) {
                logger.warn("Bulk progress listener {} failed", listener, e);
            }
        }
    }
}
