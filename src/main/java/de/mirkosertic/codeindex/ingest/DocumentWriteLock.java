package de.mirkosertic.codeindex.ingest;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orders document writes against removals. The ingestion pipeline checks that a file still exists
 * and writes its chunks under {@link #writing()}; removals run under the exclusive
 * {@link #removing()}. A removal therefore either precedes the existence check or follows the
 * write, and a deleted file never reappears in the store.
 */
public class DocumentWriteLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Lock writing() {
        return lock.readLock();
    }

    public Lock removing() {
        return lock.writeLock();
    }
}
