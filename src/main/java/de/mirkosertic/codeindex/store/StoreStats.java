package de.mirkosertic.codeindex.store;

public record StoreStats(long documentCount, long chunkCount, long embeddedCount) {

    public boolean isEmpty() {
        return documentCount == 0 && embeddedCount == 0;
    }
}
