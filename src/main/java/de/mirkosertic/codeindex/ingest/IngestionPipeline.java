package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.config.IngestConfig;
import de.mirkosertic.codeindex.document.Chunk;
import de.mirkosertic.codeindex.document.Chunker;
import de.mirkosertic.codeindex.document.SourceDocument;
import de.mirkosertic.codeindex.embedding.EmbeddingBackend;
import de.mirkosertic.codeindex.store.StoredChunk;
import de.mirkosertic.codeindex.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chunks documents, embeds the chunks and writes them to the vector store.
 * <p>
 * Embedding calls run on a fixed pool, so at most {@code concurrency} calls are in flight. Each
 * chunk is retried on its own; a chunk that still fails is dead-lettered and the rest of the batch
 * carries on. A document's successful chunks replace its previous chunk set in one store call.
 * If none of its chunks could be embedded, the previous chunks stay untouched. A document stored
 * with missing chunks is recorded without content hash, so it is embedded again next time even if
 * its content did not change.
 * <p>
 * A document whose file was deleted while its chunks were embedded is not written; its chunks are
 * removed from the store instead. Pipelines and {@link RemovalService}s sharing a
 * {@link DocumentWriteLock} never interleave that check with a removal.
 */
public class IngestionPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    private final EmbeddingBackend backend;
    private final VectorStore store;
    private final Chunker chunker;
    private final RetryPolicy retryPolicy;
    private final IndexingStatsTracker stats;
    private final boolean skipUnchanged;
    private final ExecutorService embeddingExecutor;
    private final Semaphore storeSlots;
    private final DocumentWriteLock writeLock;
    private final AtomicInteger batchCounter = new AtomicInteger();

    public IngestionPipeline(final EmbeddingBackend backend,
                             final VectorStore store,
                             final Chunker chunker,
                             final IngestConfig config,
                             final IndexingStatsTracker stats) {
        this(backend, store, chunker, config, stats, new DocumentWriteLock());
    }

    public IngestionPipeline(final EmbeddingBackend backend,
                             final VectorStore store,
                             final Chunker chunker,
                             final IngestConfig config,
                             final IndexingStatsTracker stats,
                             final DocumentWriteLock writeLock) {
        this.backend = backend;
        this.store = store;
        this.chunker = chunker;
        this.retryPolicy = new RetryPolicy(config.maxAttempts(), config.backoffBase(), config.backoffMax());
        this.stats = stats;
        this.skipUnchanged = config.skipUnchanged();
        this.storeSlots = new Semaphore(config.concurrency());
        this.writeLock = writeLock;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        this.embeddingExecutor = Executors.newFixedThreadPool(config.concurrency(), r -> {
            final Thread thread = new Thread(r, "embedding-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Processes one batch. Never throws for individual document or chunk failures; they are
     * reported in the result.
     *
     * @throws de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException if the store holds
     *         vectors of a different model
     */
    public BatchResult process(final List<SourceDocument> documents, final int batchNumber) {
        return process(documents, batchNumber, skipUnchanged);
    }

    /**
     * As {@link #process(List, int)}, with the unchanged-content check switched explicitly.
     * A manual reindex passes {@code false} to re-embed regardless of the stored hash.
     */
    public BatchResult process(final List<SourceDocument> documents, final int batchNumber,
                               final boolean skipIfUnchanged) {
        final long start = System.currentTimeMillis();
        if (documents.isEmpty()) {
            return BatchResult.empty(batchNumber);
        }

        try {
            store.bindEmbeddingModel(backend.modelId(), backend.dimension());
        } catch (final IOException e) {
            logger.error("Batch {}: cannot record embedding model in vector store", batchNumber, e);
            final BatchResult failed = new BatchResult(batchNumber, documents.size(), 0, documents.size(), 0, 0, 0,
                    System.currentTimeMillis() - start, List.of());
            stats.recordBatch(failed);
            return failed;
        }

        final List<DocumentWork> work = new ArrayList<>(documents.size());
        int skipped = 0;
        for (final SourceDocument document : documents) {
            if (skipIfUnchanged && isUnchanged(document)) {
                logger.debug("Skipping unchanged document {}", document.id());
                skipped++;
                continue;
            }
            final List<Chunk> chunks = chunker.chunk(document);
            final List<Future<float[]>> futures = new ArrayList<>(chunks.size());
            for (final Chunk chunk : chunks) {
                futures.add(embeddingExecutor.submit(() ->
                        retryPolicy.execute(() -> backend.embed(chunk.text()), "Embedding " + chunk.chunkId())));
            }
            work.add(new DocumentWork(document, chunks, futures));
        }

        int indexed = 0;
        int failedDocuments = 0;
        int chunksProcessed = 0;
        int chunksFailed = 0;
        final List<ChunkFailure> failures = new ArrayList<>();

        for (final DocumentWork item : work) {
            if (Thread.currentThread().isInterrupted()) {
                item.cancel();
                failedDocuments++;
                chunksFailed += item.chunks().size();
                continue;
            }

            final List<StoredChunk> embedded = new ArrayList<>(item.chunks().size());
            for (int i = 0; i < item.chunks().size(); i++) {
                final Chunk chunk = item.chunks().get(i);
                try {
                    embedded.add(StoredChunk.of(item.document(), chunk, item.futures().get(i).get()));
                } catch (final ExecutionException e) {
                    final ChunkFailure failure = failureOf(chunk, e.getCause());
                    failures.add(failure);
                    stats.recordDeadLetter(failure);
                    chunksFailed++;
                    logger.warn("Chunk {} failed: {}", chunk.chunkId(), failure.message());
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    item.cancel();
                    chunksFailed += item.chunks().size() - i;
                    break;
                }
            }

            if (embedded.size() < item.chunks().size() && Thread.currentThread().isInterrupted()) {
                failedDocuments++;
                continue;
            }
            if (embedded.isEmpty()) {
                failedDocuments++;
                logger.warn("No chunk of {} could be embedded, keeping its previous chunks", item.document().id());
                continue;
            }

            final List<StoredChunk> toStore;
            if (embedded.size() < item.chunks().size()) {
                logger.warn("Storing {} of {} chunks of {} without content hash",
                        embedded.size(), item.chunks().size(), item.document().id());
                toStore = embedded.stream().map(StoredChunk::withoutContentHash).toList();
            } else {
                toStore = embedded;
            }

            storeSlots.acquireUninterruptibly();
            writeLock.writing().lock();
            try {
                if (!Files.exists(item.document().absolutePath())) {
                    skipped++;
                    removeVanished(item.document());
                    continue;
                }
                retryPolicy.execute(() -> {
                    try {
                        store.replaceDocument(item.document().id(), toStore);
                        return null;
                    } catch (final IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }, "Storing " + item.document().id());
                indexed++;
                chunksProcessed += toStore.size();
            } catch (final RetryPolicy.RetryExhaustedException e) {
                failedDocuments++;
                chunksFailed += embedded.size();
                failures.add(new ChunkFailure(item.document().id(), item.document().id(), e.getAttempts(),
                        e.getMessage(), System.currentTimeMillis()));
                logger.error("Storing chunks of {} failed", item.document().id(), e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                failedDocuments++;
                chunksFailed += embedded.size();
            } finally {
                writeLock.writing().unlock();
                storeSlots.release();
            }
        }

        final BatchResult result = new BatchResult(batchNumber, documents.size(), indexed, failedDocuments, skipped,
                chunksProcessed, chunksFailed, System.currentTimeMillis() - start, failures);
        stats.recordBatch(result);
        logger.info("Batch {}: {} documents indexed, {} failed, {} skipped; {} chunks stored, {} failed in {}ms",
                batchNumber, indexed, failedDocuments, skipped, chunksProcessed, chunksFailed, result.durationMs());
        return result;
    }

    private void removeVanished(final SourceDocument document) {
        try {
            final long removed = store.deleteByDocument(document.id());
            logger.info("{} was deleted while being embedded, removed {} stored chunks", document.id(), removed);
        } catch (final IOException e) {
            logger.warn("{} was deleted while being embedded, but its stored chunks could not be removed",
                    document.id(), e);
        }
    }

    private boolean isUnchanged(final SourceDocument document) {
        try {
            final Optional<String> storedHash = store.contentHash(document.id());
            return storedHash.isPresent() && storedHash.get().equals(document.contentHash());
        } catch (final IOException e) {
            logger.debug("Cannot read stored hash of {}, reindexing", document.id(), e);
            return false;
        }
    }

    private ChunkFailure failureOf(final Chunk chunk, final Throwable cause) {
        final int attempts = cause instanceof RetryPolicy.RetryExhaustedException exhausted ? exhausted.getAttempts() : 1;
        return new ChunkFailure(chunk.documentId(), chunk.chunkId(), attempts, String.valueOf(cause.getMessage()),
                System.currentTimeMillis());
    }

    /**
     * Splits the documents into batches, processes them in order and streams progress.
     * Listener failures are logged and do not interrupt ingestion.
     */
    public IngestSummary ingest(final List<SourceDocument> documents, final int batchSize,
                                final IngestProgressListener listener) {
        final long start = System.currentTimeMillis();
        final int totalBatches = (documents.size() + batchSize - 1) / batchSize;
        int processed = 0;
        int indexed = 0;
        int failed = 0;
        int chunksProcessed = 0;
        int chunksFailed = 0;
        int batchIndex = 0;

        try {
            for (int from = 0; from < documents.size(); from += batchSize) {
                batchIndex++;
                final List<SourceDocument> batch = documents.subList(from, Math.min(documents.size(), from + batchSize));
                final BatchResult result = process(batch, batchCounter.incrementAndGet());
                processed += batch.size();
                indexed += result.documentsIndexed();
                failed += result.documentsFailed();
                chunksProcessed += result.chunksProcessed();
                chunksFailed += result.chunksFailed();
                emit(listener, new ProgressEvent(ProgressEvent.Type.PROGRESS, batchIndex, totalBatches, processed,
                        documents.size(), result, null));
            }
        } catch (final RuntimeException e) {
            logger.error("Ingestion aborted in batch {}/{}", batchIndex, totalBatches, e);
            emit(listener, new ProgressEvent(ProgressEvent.Type.ERROR, batchIndex, totalBatches, processed,
                    documents.size(), null, e.getMessage()));
            return new IngestSummary(documents.size(), batchIndex, indexed, documents.size() - indexed,
                    chunksProcessed, chunksFailed, System.currentTimeMillis() - start);
        }

        final IngestSummary summary = new IngestSummary(documents.size(), totalBatches, indexed, failed,
                chunksProcessed, chunksFailed, System.currentTimeMillis() - start);
        emit(listener, new ProgressEvent(ProgressEvent.Type.COMPLETE, totalBatches, totalBatches, processed,
                documents.size(), null, indexed + " documents indexed, " + failed + " failed"));
        return summary;
    }

    private static void emit(final IngestProgressListener listener, final ProgressEvent event) {
        try {
            listener.onEvent(event);
        } catch (final RuntimeException e) {
            logger.warn("Progress listener failed on {} event", event.type(), e);
        }
    }

    @Override
    public void close() {
        embeddingExecutor.shutdown();
        try {
            if (!embeddingExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Embedding workers did not terminate in time, forcing shutdown");
                embeddingExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            embeddingExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record DocumentWork(SourceDocument document, List<Chunk> chunks, List<Future<float[]>> futures) {

        void cancel() {
            for (final Future<float[]> future : futures) {
                future.cancel(true);
            }
        }
    }
}
