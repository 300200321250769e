package de.mirkosertic.codeindex.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains the {@link IndexingQueue} in batches on a single background thread.
 * <p>
 * The loop waits for a first path, sleeps for the coalescing delay so that near-simultaneous
 * changes can accumulate, then drains at most {@code batchSize - 1} further paths and hands the
 * batch to the {@link BatchHandler}.
 */
public class BatchScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);
    private static final long POLL_TIMEOUT_MS = 1000;

    private final IndexingQueue queue;
    private final int batchSize;
    private final Duration coalesceDelay;
    private final BatchHandler handler;
    private final AtomicInteger batchCounter = new AtomicInteger();

    private volatile boolean running;
    private volatile Thread schedulerThread;

    public BatchScheduler(final IndexingQueue queue, final int batchSize, final Duration coalesceDelay,
                          final BatchHandler handler) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        this.queue = queue;
        this.batchSize = batchSize;
        this.coalesceDelay = coalesceDelay;
        this.handler = handler;
    }

    public Duration getCoalesceDelay() {
        return coalesceDelay;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        final Thread thread = new Thread(this::runLoop, "index-scheduler");
        thread.setDaemon(true);
        schedulerThread = thread;
        thread.start();
        logger.info("Batch scheduler started (batchSize={}, coalesceDelay={}ms)", batchSize, coalesceDelay.toMillis());
    }

    private void runLoop() {
        while (running) {
            try {
                final Path first = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                if (!coalesceDelay.isZero()) {
                    Thread.sleep(coalesceDelay.toMillis());
                }
                final List<Path> batch = new ArrayList<>(batchSize);
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                dispatch(batch);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        logger.debug("Batch scheduler loop finished");
    }

    private void dispatch(final List<Path> batch) {
        final int batchNumber = batchCounter.incrementAndGet();
        try {
            handler.handle(List.copyOf(batch), batchNumber);
        } catch (final Exception e) {
            logger.error("Batch {} with {} paths failed", batchNumber, batch.size(), e);
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        final Thread thread = schedulerThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(5000);
                if (thread.isAlive()) {
                    logger.warn("Batch scheduler did not stop within 5s");
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        schedulerThread = null;
    }

    public boolean isRunning() {
        return running;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
