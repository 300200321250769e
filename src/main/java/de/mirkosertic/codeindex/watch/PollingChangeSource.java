package de.mirkosertic.codeindex.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Fallback change source for platforms or file systems without usable native notifications.
 * Rescans the tree at a fixed interval and diffs modification time and size per file.
 */
public class PollingChangeSource implements ChangeSource {

    private static final Logger logger = LoggerFactory.getLogger(PollingChangeSource.class);

    private final Duration interval;
    private final Predicate<Path> directoryFilter;

    private ScheduledExecutorService scheduler;
    private volatile Map<Path, FileState> snapshot = new HashMap<>();

    public PollingChangeSource(final Duration interval, final Predicate<Path> directoryFilter) {
        this.interval = interval;
        this.directoryFilter = directoryFilter;
    }

    @Override
    public synchronized void subscribe(final Path root, final FileChangeListener listener) throws IOException {
        if (scheduler != null) {
            throw new IllegalStateException("Already subscribed");
        }
        snapshot = scan(root);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "directory-poller");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> poll(root, listener),
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("Polling watcher tracking {} files below {} every {}ms", snapshot.size(), root, interval.toMillis());
    }

    @Override
    public String name() {
        return "polling";
    }

    void poll(final Path root, final FileChangeListener listener) {
        try {
            final Map<Path, FileState> current = scan(root);
            final Map<Path, FileState> previous = snapshot;
            for (final Map.Entry<Path, FileState> entry : current.entrySet()) {
                final FileState before = previous.get(entry.getKey());
                if (before == null) {
                    listener.onFileCreated(entry.getKey());
                } else if (!before.equals(entry.getValue())) {
                    listener.onFileModified(entry.getKey());
                }
            }
            for (final Path path : previous.keySet()) {
                if (!current.containsKey(path)) {
                    listener.onFileDeleted(path);
                }
            }
            snapshot = current;
        } catch (final Exception e) {
            // Must catch all exceptions: ScheduledExecutorService silently cancels
            // the periodic task if the Runnable throws.
            logger.error("Polling scan of {} failed", root, e);
        }
    }

    private Map<Path, FileState> scan(final Path root) throws IOException {
        final Map<Path, FileState> result = new HashMap<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                return directoryFilter.test(dir) ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    result.put(file, new FileState(attrs.lastModifiedTime().toMillis(), attrs.size()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
        return result;
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    private record FileState(long lastModifiedMs, long size) {
    }
}
