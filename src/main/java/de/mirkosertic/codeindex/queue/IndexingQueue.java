package de.mirkosertic.codeindex.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of paths waiting to be indexed. Producers never block: when the queue is full the
 * path is dropped and counted. A path that is already waiting is not queued a second time.
 */
public class IndexingQueue {

    private static final Logger logger = LoggerFactory.getLogger(IndexingQueue.class);

    private final int capacity;
    private final BlockingQueue<Path> queue;
    private final Set<Path> members = ConcurrentHashMap.newKeySet();
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public IndexingQueue(final int capacity) {
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false if the path was dropped because the queue is full
     */
    public boolean offer(final Path path) {
        if (!members.add(path)) {
            return true;
        }
        if (!queue.offer(path)) {
            members.remove(path);
            final long total = dropped.incrementAndGet();
            logger.warn("Indexing queue full ({} entries), dropped {} ({} dropped so far)", capacity, path, total);
            return false;
        }
        enqueued.incrementAndGet();
        return true;
    }

    public Path poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        final Path path = queue.poll(timeout, unit);
        if (path != null) {
            members.remove(path);
        }
        return path;
    }

    /**
     * Moves up to {@code max} waiting paths into {@code target} without blocking.
     */
    public int drainTo(final List<Path> target, final int max) {
        int moved = 0;
        while (moved < max) {
            final Path path = queue.poll();
            if (path == null) {
                break;
            }
            members.remove(path);
            target.add(path);
            moved++;
        }
        return moved;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long enqueuedCount() {
        return enqueued.get();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
