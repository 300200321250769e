package de.mirkosertic.codeindex.bulk;

/**
 * Persisted outcome of the most recent bulk run, used to resume an interrupted run after a restart.
 */
public record BulkState(
        /** Status the run was last seen in. */
        BulkStatus status,
        /** True if the run was ended early by a stop request. */
        boolean stopped,
        long startedAtMs,
        long updatedAtMs,
        int totalFiles,
        int processedFiles,
        int failedFiles
) {

    /**
     * A run is unfinished if it never reached COMPLETED, or was stopped before it did.
     */
    public boolean isUnfinished() {
        return switch (status) {
            case INDEXING, STOPPING, FAILED -> true;
            case COMPLETED -> stopped;
            case IDLE, DISCOVERING -> false;
        };
    }
}
