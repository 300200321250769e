package de.mirkosertic.codeindex.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Change source backed by the platform {@link WatchService}. Every accepted directory below the
 * root is registered, directories created later are registered as they appear.
 */
public class NativeChangeSource implements ChangeSource {

    private static final Logger logger = LoggerFactory.getLogger(NativeChangeSource.class);

    private final Duration pollTimeout;
    private final Predicate<Path> directoryFilter;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();

    private volatile WatchService watchService;
    private volatile Thread watchThread;
    private volatile boolean running;

    public NativeChangeSource(final Duration pollTimeout, final Predicate<Path> directoryFilter) {
        this.pollTimeout = pollTimeout;
        this.directoryFilter = directoryFilter;
    }

    @Override
    public synchronized void subscribe(final Path root, final FileChangeListener listener) throws IOException {
        if (running) {
            throw new IllegalStateException("Already subscribed");
        }
        watchService = FileSystems.getDefault().newWatchService();
        try {
            registerRecursive(root);
        } catch (final IOException e) {
            watchService.close();
            watchKeys.clear();
            throw e;
        }

        running = true;
        final Thread thread = new Thread(() -> processEvents(listener), "directory-watcher");
        thread.setDaemon(true);
        watchThread = thread;
        thread.start();
        logger.info("Native watcher registered {} directories below {}", watchKeys.size(), root);
    }

    @Override
    public String name() {
        return "native";
    }

    private void registerRecursive(final Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                if (!directoryFilter.test(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.debug("Cannot visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents(final FileChangeListener listener) {
        logger.debug("Directory watcher started");

        while (running) {
            final WatchKey key;
            try {
                key = watchService.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                break;
            }

            final Path directory = watchKeys.get(key);
            if (directory == null) {
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();
                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow below {}, some changes may need a manual reindex", directory);
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = directory.resolve(pathEvent.context());

                try {
                    if (kind == ENTRY_CREATE) {
                        if (Files.isDirectory(fullPath)) {
                            if (directoryFilter.test(fullPath)) {
                                registerRecursive(fullPath);
                                announceExistingFiles(fullPath, listener);
                            }
                        } else if (Files.isRegularFile(fullPath)) {
                            listener.onFileCreated(fullPath);
                        }
                    } else if (kind == ENTRY_MODIFY) {
                        if (Files.isRegularFile(fullPath)) {
                            listener.onFileModified(fullPath);
                        }
                    } else if (kind == ENTRY_DELETE) {
                        listener.onFileDeleted(fullPath);
                    }
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            if (!key.reset()) {
                watchKeys.remove(key);
            }
        }

        logger.debug("Directory watcher stopped");
    }

    /**
     * Files moved in together with their directory produce no events of their own.
     */
    private void announceExistingFiles(final Path directory, final FileChangeListener listener) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                return directoryFilter.test(dir) ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    listener.onFileCreated(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public synchronized void close() {
        running = false;
        final WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (final IOException e) {
                logger.warn("Error closing watch service", e);
            }
        }
        final Thread thread = watchThread;
        if (thread != null) {
            try {
                thread.join(5000);
                if (thread.isAlive()) {
                    logger.warn("Directory watcher thread did not stop within 5s");
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        watchThread = null;
        watchKeys.clear();
    }
}
