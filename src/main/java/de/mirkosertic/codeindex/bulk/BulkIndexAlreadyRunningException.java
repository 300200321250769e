package de.mirkosertic.codeindex.bulk;

/**
 * Thrown when a bulk run is requested while another one is active.
 */
public class BulkIndexAlreadyRunningException extends RuntimeException {

    private final BulkStatus currentStatus;

    public BulkIndexAlreadyRunningException(final BulkStatus currentStatus) {
        super("Bulk indexing is already running (status " + currentStatus + ")");
        this.currentStatus = currentStatus;
    }

    public BulkStatus getCurrentStatus() {
        return currentStatus;
    }
}
