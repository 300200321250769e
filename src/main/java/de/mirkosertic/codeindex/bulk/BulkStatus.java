package de.mirkosertic.codeindex.bulk;

/**
 * Lifecycle of a bulk run. Within a run the status only moves forward; a finished run
 * (COMPLETED or FAILED) may be followed by a fresh one, which starts again at DISCOVERING.
 */
public enum BulkStatus {
    IDLE,
    DISCOVERING,
    INDEXING,
    STOPPING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == DISCOVERING || this == INDEXING || this == STOPPING;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(final BulkStatus next) {
        return switch (this) {
            case IDLE, COMPLETED, FAILED -> next == DISCOVERING;
            case DISCOVERING -> next == INDEXING || next == COMPLETED || next == FAILED;
            case INDEXING -> next == STOPPING || next == COMPLETED || next == FAILED;
            case STOPPING -> next == COMPLETED || next == FAILED;
        };
    }
}
