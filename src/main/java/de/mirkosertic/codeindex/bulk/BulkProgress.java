package de.mirkosertic.codeindex.bulk;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a bulk run. {@code stopped} is set when a run ended early on request.
 */
public record BulkProgress(
        BulkStatus status,
        int totalFiles,
        int processedFiles,
        int failedFiles,
        int skippedFiles,
        int currentBatch,
        int totalBatches,
        @Nullable Instant startTime,
        @Nullable Instant estimatedCompletion,
        @Nullable String currentFile,
        boolean stopped,
        List<BulkError> errors,
        @Nullable String message
) {

    public BulkProgress {
        errors = List.copyOf(errors);
    }

    public static BulkProgress idle() {
        return new BulkProgress(BulkStatus.IDLE, 0, 0, 0, 0, 0, 0, null, null, null, false, List.of(), null);
    }

    public double percentComplete() {
        if (totalFiles == 0) {
            return status == BulkStatus.COMPLETED ? 100.0 : 0.0;
        }
        return (processedFiles * 100.0) / totalFiles;
    }
}
