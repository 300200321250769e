package de.mirkosertic.codeindex.bulk;

public record BulkStartResult(Outcome outcome, String reason) {

    public enum Outcome {
        STARTED,
        SKIPPED
    }

    public static BulkStartResult started(final String reason) {
        return new BulkStartResult(Outcome.STARTED, reason);
    }

    public static BulkStartResult skipped(final String reason) {
        return new BulkStartResult(Outcome.SKIPPED, reason);
    }

    public boolean isStarted() {
        return outcome == Outcome.STARTED;
    }
}
