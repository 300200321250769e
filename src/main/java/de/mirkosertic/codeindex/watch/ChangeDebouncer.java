package de.mirkosertic.codeindex.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Coalesces bursts of change events per path. A path is released to the sink only after no event
 * for it arrived for the full debounce interval.
 */
public class ChangeDebouncer {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDebouncer.class);
    private static final long MAX_FLUSH_INTERVAL_MS = 500;

    private final Duration debounce;
    private final Predicate<Path> sink;
    private final Clock clock;
    private final Map<Path, PendingChange> pending = new ConcurrentHashMap<>();

    private ScheduledExecutorService flushScheduler;

    /**
     * @param sink receives ready paths; returns false if the path could not be accepted (queue full)
     */
    public ChangeDebouncer(final Duration debounce, final Predicate<Path> sink, final Clock clock) {
        this.debounce = debounce;
        this.sink = sink;
        this.clock = clock;
    }

    public void record(final Path path, final ChangeKind kind) {
        final Instant now = clock.instant();
        pending.compute(path, (p, existing) ->
                existing == null ? PendingChange.first(p, kind, now) : existing.refresh(kind, now));
    }

    /**
     * Forgets a pending change, used when the path was deleted before it settled.
     */
    public void cancel(final Path path) {
        pending.remove(path);
    }

    /**
     * Releases every path whose last event is at least one debounce interval old.
     *
     * @return number of paths handed to the sink
     */
    public int flushReady() {
        final Instant cutoff = clock.instant().minus(debounce);
        int released = 0;
        for (final PendingChange change : pending.values()) {
            if (change.lastSeen().isAfter(cutoff)) {
                continue;
            }
            // Only remove the exact entry we looked at; a concurrent refresh keeps it pending
            if (pending.remove(change.path(), change)) {
                if (sink.test(change.path())) {
                    released++;
                }
            }
        }
        return released;
    }

    public int pendingCount() {
        return pending.size();
    }

    public synchronized void start() {
        if (flushScheduler != null) {
            return;
        }
        final long intervalMs = Math.max(10, Math.min(debounce.toMillis(), MAX_FLUSH_INTERVAL_MS));
        flushScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "watch-debounce");
            t.setDaemon(true);
            return t;
        });
        flushScheduler.scheduleWithFixedDelay(this::flushSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void flushSafely() {
        try {
            final int released = flushReady();
            if (released > 0) {
                logger.debug("Released {} debounced changes, {} still pending", released, pending.size());
            }
        } catch (final Exception e) {
            logger.error("Debounce flush failed", e);
        }
    }

    public synchronized void stop() {
        if (flushScheduler == null) {
            return;
        }
        flushScheduler.shutdown();
        try {
            if (!flushScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                flushScheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            flushScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        flushScheduler = null;
        pending.clear();
    }
}
