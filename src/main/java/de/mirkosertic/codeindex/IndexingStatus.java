package de.mirkosertic.codeindex;

import de.mirkosertic.codeindex.bulk.BulkProgress;
import de.mirkosertic.codeindex.ingest.IndexingStats;
import de.mirkosertic.codeindex.store.StoreStats;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view over every part of the service, for status reporting.
 */
public record IndexingStatus(
        IndexingStats indexing,
        StoreStats store,
        BulkProgress bulk,
        boolean watching,
        @Nullable String changeSource,
        String embeddingModel,
        @Nullable String storeEmbeddingModel,
        long queryCacheHits,
        long queryCacheMisses
) {
}
