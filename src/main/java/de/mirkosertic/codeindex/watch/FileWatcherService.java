package de.mirkosertic.codeindex.watch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Turns raw change events into debounced indexing signals.
 * <p>
 * Created and modified files that pass the {@link ChangeFilter} go through the
 * {@link ChangeDebouncer}. Deletions skip debouncing and go straight to the removal handler.
 * When the primary source cannot be opened the service falls back to the secondary source if one
 * is configured, otherwise it keeps running without live updates.
 */
public class FileWatcherService implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(FileWatcherService.class);

    private final Path root;
    private final ChangeFilter filter;
    private final ChangeSource primary;
    private final @Nullable ChangeSource fallback;
    private final ChangeDebouncer debouncer;
    private final Consumer<Path> removalHandler;

    private volatile @Nullable ChangeSource activeSource;

    public FileWatcherService(final ChangeFilter filter,
                              final ChangeSource primary,
                              final @Nullable ChangeSource fallback,
                              final ChangeDebouncer debouncer,
                              final Consumer<Path> removalHandler) {
        this.root = filter.getRoot();
        this.filter = filter;
        this.primary = primary;
        this.fallback = fallback;
        this.debouncer = debouncer;
        this.removalHandler = removalHandler;
    }

    /**
     * @return true if live change notifications are active
     */
    public synchronized boolean start() {
        if (activeSource != null) {
            return true;
        }
        debouncer.start();
        if (trySubscribe(primary)) {
            return true;
        }
        if (fallback != null && trySubscribe(fallback)) {
            return true;
        }
        logger.warn("No change source available for {}; continuing without live updates, "
                + "bulk and manual reindex remain available", root);
        return false;
    }

    private boolean trySubscribe(final ChangeSource source) {
        try {
            source.subscribe(root, this);
            activeSource = source;
            logger.info("Watching {} using {} change source", root, source.name());
            return true;
        } catch (final IOException | RuntimeException e) {
            logger.warn("Could not open {} change source for {}: {}", source.name(), root, e.getMessage());
            source.close();
            return false;
        }
    }

    public synchronized void stop() {
        final ChangeSource source = activeSource;
        activeSource = null;
        if (source != null) {
            source.close();
        }
        debouncer.stop();
        logger.info("Stopped watching {}", root);
    }

    public boolean isWatching() {
        return activeSource != null;
    }

    public @Nullable String activeSourceName() {
        final ChangeSource source = activeSource;
        return source != null ? source.name() : null;
    }

    @Override
    public void onFileCreated(final Path file) {
        onChange(file, ChangeKind.CREATED);
    }

    @Override
    public void onFileModified(final Path file) {
        onChange(file, ChangeKind.MODIFIED);
    }

    private void onChange(final Path file, final ChangeKind kind) {
        if (filter.shouldWatch(file)) {
            debouncer.record(file, kind);
        } else {
            logger.trace("Ignoring {} event for filtered path {}", kind, file);
        }
    }

    @Override
    public void onFileDeleted(final Path file) {
        debouncer.cancel(file);
        if (filter.isExcluded(file)) {
            return;
        }
        try {
            removalHandler.accept(file);
        } catch (final RuntimeException e) {
            logger.error("Removal of {} failed", file, e);
        }
    }
}
