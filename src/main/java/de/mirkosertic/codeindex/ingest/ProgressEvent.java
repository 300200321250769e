package de.mirkosertic.codeindex.ingest;

import org.jspecify.annotations.Nullable;

/**
 * Streamed to callers of {@link IngestionPipeline#ingest}: one {@code PROGRESS} per batch, then a
 * single {@code COMPLETE} or {@code ERROR}.
 */
public record ProgressEvent(
        Type type,
        int batchNumber,
        int totalBatches,
        int processedDocuments,
        int totalDocuments,
        @Nullable BatchResult batch,
        @Nullable String message
) {

    public enum Type {
        PROGRESS,
        COMPLETE,
        ERROR
    }
}
