package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.document.DocumentIdResolver;
import de.mirkosertic.codeindex.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Deletes the chunks of removed files. Removing an unknown path is a no-op, so repeated delete
 * events are harmless. A removed directory produces a single delete event, so when no document
 * matches the path exactly every document below it is removed instead.
 */
public class RemovalService {

    private static final Logger logger = LoggerFactory.getLogger(RemovalService.class);

    private final VectorStore store;
    private final DocumentIdResolver idResolver;
    private final IndexingStatsTracker stats;
    private final DocumentWriteLock writeLock;

    public RemovalService(final VectorStore store, final DocumentIdResolver idResolver,
                          final IndexingStatsTracker stats) {
        this(store, idResolver, stats, new DocumentWriteLock());
    }

    public RemovalService(final VectorStore store, final DocumentIdResolver idResolver,
                          final IndexingStatsTracker stats, final DocumentWriteLock writeLock) {
        this.store = store;
        this.idResolver = idResolver;
        this.stats = stats;
        this.writeLock = writeLock;
    }

    /**
     * @return true if anything was removed
     */
    public boolean remove(final Path path) {
        final String documentId = idResolver.documentId(path);
        writeLock.removing().lock();
        try {
            final long removed = store.deleteByDocument(documentId);
            if (removed > 0) {
                stats.recordRemoved();
                logger.info("Removed {} chunks of {}", removed, documentId);
                return true;
            }

            final String prefix = documentId.endsWith("/") ? documentId : documentId + "/";
            final List<String> nested = store.documentIds().stream()
                    .filter(id -> id.startsWith(prefix))
                    .toList();
            for (final String id : nested) {
                store.deleteByDocument(id);
                stats.recordRemoved();
            }
            if (!nested.isEmpty()) {
                logger.info("Removed {} documents below {}", nested.size(), documentId);
                return true;
            }
            logger.debug("Nothing stored for {}", documentId);
            return false;
        } catch (final IOException e) {
            stats.recordError();
            logger.error("Failed to remove {} from the vector store", documentId, e);
            return false;
        } finally {
            writeLock.removing().unlock();
        }
    }
}
