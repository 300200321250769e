package de.mirkosertic.codeindex.ingest;

import java.util.List;

/**
 * Outcome of one ingestion batch.
 *
 * @param documentsSkipped documents whose content hash matched the stored chunks
 */
public record BatchResult(
        int batchNumber,
        int documents,
        int documentsIndexed,
        int documentsFailed,
        int documentsSkipped,
        int chunksProcessed,
        int chunksFailed,
        long durationMs,
        List<ChunkFailure> failures
) {

    public BatchResult {
        failures = List.copyOf(failures);
    }

    public static BatchResult empty(final int batchNumber) {
        return new BatchResult(batchNumber, 0, 0, 0, 0, 0, 0, 0, List.of());
    }
}
