package de.mirkosertic.codeindex.ingest;

import java.util.List;

/**
 * Point-in-time copy of the indexing counters.
 */
public record IndexingStats(
        long filesIndexed,
        long filesRemoved,
        long filesSkippedUnchanged,
        long errors,
        long chunksIndexed,
        long chunksFailed,
        long batchesProcessed,
        int lastBatchProcessed,
        int lastBatchFailed,
        int queueDepth,
        long queueDropped,
        long deadLettered,
        List<ChunkFailure> recentDeadLetters,
        long startTimeMs,
        long snapshotTimeMs
) {

    public IndexingStats {
        recentDeadLetters = List.copyOf(recentDeadLetters);
    }

    public double filesPerSecond() {
        final long elapsedMs = snapshotTimeMs - startTimeMs;
        if (elapsedMs <= 0) {
            return 0;
        }
        return filesIndexed / (elapsedMs / 1000.0);
    }
}
