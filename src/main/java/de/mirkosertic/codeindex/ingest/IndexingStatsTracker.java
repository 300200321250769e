package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.queue.IndexingQueue;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for continuous and bulk indexing. Thread-safe; readers get immutable
 * {@link IndexingStats} snapshots.
 */
public class IndexingStatsTracker {

    private static final Logger logger = LoggerFactory.getLogger(IndexingStatsTracker.class);
    static final int DEAD_LETTER_CAPACITY = 100;

    private final AtomicLong filesIndexed = new AtomicLong();
    private final AtomicLong filesRemoved = new AtomicLong();
    private final AtomicLong filesSkippedUnchanged = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong chunksIndexed = new AtomicLong();
    private final AtomicLong chunksFailed = new AtomicLong();
    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final Deque<ChunkFailure> deadLetters = new ArrayDeque<>();

    private volatile int lastBatchProcessed;
    private volatile int lastBatchFailed;
    private volatile long startTime = System.currentTimeMillis();
    private volatile @Nullable IndexingQueue queue;

    private final ScheduledExecutorService statsTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "stats-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile @Nullable ScheduledFuture<?> statsTimerFuture;

    public void attachQueue(final IndexingQueue queue) {
        this.queue = queue;
    }

    public void recordBatch(final BatchResult result) {
        batchesProcessed.incrementAndGet();
        filesIndexed.addAndGet(result.documentsIndexed());
        filesSkippedUnchanged.addAndGet(result.documentsSkipped());
        errors.addAndGet(result.documentsFailed());
        chunksIndexed.addAndGet(result.chunksProcessed());
        chunksFailed.addAndGet(result.chunksFailed());
        lastBatchProcessed = result.documentsIndexed() + result.documentsSkipped();
        lastBatchFailed = result.documentsFailed();
    }

    public void recordRemoved() {
        filesRemoved.incrementAndGet();
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public void recordDeadLetter(final ChunkFailure failure) {
        deadLettered.incrementAndGet();
        synchronized (deadLetters) {
            deadLetters.addLast(failure);
            while (deadLetters.size() > DEAD_LETTER_CAPACITY) {
                deadLetters.removeFirst();
            }
        }
    }

    public void reset() {
        filesIndexed.set(0);
        filesRemoved.set(0);
        filesSkippedUnchanged.set(0);
        errors.set(0);
        chunksIndexed.set(0);
        chunksFailed.set(0);
        batchesProcessed.set(0);
        deadLettered.set(0);
        synchronized (deadLetters) {
            deadLetters.clear();
        }
        lastBatchProcessed = 0;
        lastBatchFailed = 0;
        startTime = System.currentTimeMillis();
    }

    public IndexingStats getStatistics() {
        final IndexingQueue currentQueue = queue;
        final ArrayList<ChunkFailure> recent;
        synchronized (deadLetters) {
            recent = new ArrayList<>(deadLetters);
        }
        return new IndexingStats(
                filesIndexed.get(),
                filesRemoved.get(),
                filesSkippedUnchanged.get(),
                errors.get(),
                chunksIndexed.get(),
                chunksFailed.get(),
                batchesProcessed.get(),
                lastBatchProcessed,
                lastBatchFailed,
                currentQueue != null ? currentQueue.size() : 0,
                currentQueue != null ? currentQueue.droppedCount() : 0,
                deadLettered.get(),
                recent,
                startTime,
                System.currentTimeMillis());
    }

    public synchronized void startPeriodicLogging(final Duration interval) {
        if (statsTimerFuture != null) {
            return;
        }
        statsTimerFuture = statsTimerExecutor.scheduleAtFixedRate(this::logStatistics,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void logStatistics() {
        try {
            final IndexingStats stats = getStatistics();
            logger.info("Indexing stats: indexed={}, removed={}, unchanged={}, errors={}, chunks={}/{} failed, "
                            + "queue={} (dropped {}), deadLettered={}, {} files/sec",
                    stats.filesIndexed(), stats.filesRemoved(), stats.filesSkippedUnchanged(), stats.errors(),
                    stats.chunksIndexed(), stats.chunksFailed(), stats.queueDepth(), stats.queueDropped(),
                    stats.deadLettered(), String.format("%.2f", stats.filesPerSecond()));
        } catch (final Exception e) {
            // Must catch all exceptions: ScheduledExecutorService silently cancels
            // the periodic task if the Runnable throws any uncaught exception.
            logger.error("Failed to log indexing statistics", e);
        }
    }

    public synchronized void shutdown() {
        final ScheduledFuture<?> future = statsTimerFuture;
        if (future != null) {
            future.cancel(false);
            statsTimerFuture = null;
        }
        statsTimerExecutor.shutdown();
        try {
            if (!statsTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                statsTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            statsTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
