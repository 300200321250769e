package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.config.ChunkingConfig;
import de.mirkosertic.codeindex.config.IngestConfig;
import de.mirkosertic.codeindex.document.Chunker;
import de.mirkosertic.codeindex.document.SourceDocument;
import de.mirkosertic.codeindex.embedding.EmbeddingBackend;
import de.mirkosertic.codeindex.embedding.EmbeddingException;
import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import de.mirkosertic.codeindex.embedding.HashingEmbeddingBackend;
import de.mirkosertic.codeindex.store.LuceneVectorStore;
import de.mirkosertic.codeindex.store.StoredChunk;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

    // 10 words per chunk, 2 words shared, no minimum
    private static final ChunkingConfig CHUNKING = new ChunkingConfig(14, 0, 0.2);
    private static final IngestConfig INGEST = new IngestConfig(2, 3, Duration.ofMillis(1), Duration.ofMillis(5), true);

    @TempDir
    Path root;

    private ScriptedBackend backend;
    private LuceneVectorStore store;
    private IndexingStatsTracker stats;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        backend = new ScriptedBackend();
        store = new LuceneVectorStore(new ByteBuffersDirectory(), Duration.ZERO);
        stats = new IndexingStatsTracker();
        pipeline = new IngestionPipeline(backend, store, new Chunker(CHUNKING), INGEST, stats);
    }

    @AfterEach
    void tearDown() throws IOException {
        pipeline.close();
        stats.shutdown();
        store.close();
    }

    private SourceDocument document(final String id, final String content) {
        final Path file = root.resolve(id);
        try {
            Files.writeString(file, content);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return new SourceDocument(id, file, content, "python", "python", content.length(), 1,
                "hash-" + content.hashCode(), Map.of("language", "python"));
    }

    private static String words(final int count) {
        return IntStream.range(0, count).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("Batch processing")
    class BatchProcessing {

        @Test
        @DisplayName("Should chunk, embed and store every document")
        void shouldIndexDocuments() throws IOException {
            // Given: 15 words make two chunks
            final List<SourceDocument> documents = List.of(document("a.py", words(15)), document("b.py", "short file"));

            // When
            final BatchResult result = pipeline.process(documents, 1);

            // Then
            assertThat(result.documentsIndexed()).isEqualTo(2);
            assertThat(result.documentsFailed()).isZero();
            assertThat(result.chunksProcessed()).isEqualTo(3);
            assertThat(store.documentIds()).containsExactly("a.py", "b.py");
            assertThat(store.stats().chunkCount()).isEqualTo(3);
            assertThat(store.embeddingModel()).contains("scripted");
            assertThat(stats.getStatistics().filesIndexed()).isEqualTo(2);
        }

        @Test
        @DisplayName("An empty batch should do nothing")
        void emptyBatchShouldDoNothing() {
            final BatchResult result = pipeline.process(List.of(), 7);

            assertThat(result).isEqualTo(BatchResult.empty(7));
            assertThat(backend.calls()).isZero();
        }

        @Test
        @DisplayName("Reprocessing a changed document should replace its chunks")
        void shouldReplaceChangedDocument() throws IOException {
            pipeline.process(List.of(document("a.py", words(15))), 1);

            pipeline.process(List.of(document("a.py", "now a single chunk")), 2);

            assertThat(store.stats().chunkCount()).isEqualTo(1);
            assertThat(store.contentHash("a.py")).contains("hash-" + "now a single chunk".hashCode());
        }

        @Test
        @DisplayName("Should skip documents whose content is unchanged")
        void shouldSkipUnchangedDocuments() {
            final SourceDocument document = document("a.py", "stable content");
            pipeline.process(List.of(document), 1);
            final int callsAfterFirst = backend.calls();

            final BatchResult second = pipeline.process(List.of(document), 2);

            assertThat(second.documentsSkipped()).isEqualTo(1);
            assertThat(second.documentsIndexed()).isZero();
            assertThat(backend.calls()).isEqualTo(callsAfterFirst);
        }

        @Test
        @DisplayName("Should re-embed unchanged documents when asked to")
        void shouldReembedWhenForced() {
            final SourceDocument document = document("a.py", "stable content");
            pipeline.process(List.of(document), 1);

            final BatchResult second = pipeline.process(List.of(document), 2, false);

            assertThat(second.documentsIndexed()).isEqualTo(1);
            assertThat(backend.calls()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should refuse to mix vectors of different models")
        void shouldRefuseModelMismatch() throws IOException {
            // Given
            store.bindEmbeddingModel("other-model", 8);
            store.upsert(new StoredChunk("x.py#0", "x.py", 0, "/work/x.py", "text",
                    new HashingEmbeddingBackend(8).embed("text"), "h", Map.of()));

            // When / Then
            assertThatThrownBy(() -> pipeline.process(List.of(document("a.py", "content")), 1))
                    .isInstanceOf(EmbeddingModelMismatchException.class);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Transient failures within the attempt cap should not fail the document")
        void shouldRetryTransientFailures() throws IOException {
            // Given: every text fails twice, the cap is three attempts
            backend.failTransiently(text -> true, 2);

            // When
            final BatchResult result = pipeline.process(List.of(document("a.py", "retry me")), 1);

            // Then
            assertThat(result.documentsIndexed()).isEqualTo(1);
            assertThat(result.chunksFailed()).isZero();
            assertThat(result.failures()).isEmpty();
            assertThat(backend.calls()).isEqualTo(3);
            assertThat(store.documentIds()).containsExactly("a.py");
        }

        @Test
        @DisplayName("A chunk that keeps failing should be dead-lettered while its siblings are stored")
        void shouldDeadLetterFailingChunk() throws IOException {
            // Given: only the second chunk contains w14
            backend.failTransiently(text -> text.contains("w14"), Integer.MAX_VALUE);

            // When
            final BatchResult result = pipeline.process(List.of(document("a.py", words(15))), 1);

            // Then
            assertThat(result.documentsIndexed()).isEqualTo(1);
            assertThat(result.chunksProcessed()).isEqualTo(1);
            assertThat(result.chunksFailed()).isEqualTo(1);
            assertThat(result.failures()).singleElement().satisfies(failure -> {
                assertThat(failure.chunkId()).isEqualTo("a.py#1");
                assertThat(failure.attempts()).isEqualTo(3);
            });
            assertThat(stats.getStatistics().recentDeadLetters()).hasSize(1);
            assertThat(store.stats().chunkCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A document without any embedded chunk should keep its previous chunks")
        void shouldKeepPreviousChunksWhenAllFail() throws IOException {
            // Given
            pipeline.process(List.of(document("a.py", "version one")), 1);
            backend.failTransiently(text -> text.contains("two"), Integer.MAX_VALUE);

            // When
            final BatchResult result = pipeline.process(List.of(document("a.py", "version two")), 2);

            // Then
            assertThat(result.documentsFailed()).isEqualTo(1);
            assertThat(store.contentHash("a.py")).contains("hash-" + "version one".hashCode());
            assertThat(store.stats().chunkCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Fatal failures should not be retried")
        void shouldNotRetryFatalFailures() {
            backend.failFatally(text -> true);

            final BatchResult result = pipeline.process(List.of(document("a.py", "bad input")), 1);

            assertThat(result.documentsFailed()).isEqualTo(1);
            assertThat(result.failures()).singleElement()
                    .satisfies(failure -> assertThat(failure.attempts()).isEqualTo(1));
            assertThat(backend.calls()).isEqualTo(1);
        }

        @Test
        @DisplayName("A partially stored document should be embedded again even if unchanged")
        void partiallyStoredDocumentShouldBeReembedded() throws IOException {
            // Given: the second of two chunks is rejected on the first pass
            final SourceDocument document = document("a.py", words(15));
            backend.failFatally(text -> text.contains("w14"));
            final BatchResult first = pipeline.process(List.of(document), 1);
            assertThat(first.chunksProcessed()).isEqualTo(1);
            assertThat(first.chunksFailed()).isEqualTo(1);
            assertThat(store.contentHash("a.py")).isEmpty();

            // When: the backend recovers and the same content comes by again
            backend.failFatally(text -> false);
            final BatchResult second = pipeline.process(List.of(document), 2);

            // Then
            assertThat(second.documentsSkipped()).isZero();
            assertThat(second.documentsIndexed()).isEqualTo(1);
            assertThat(store.stats().chunkCount()).isEqualTo(2);
            assertThat(store.contentHash("a.py")).contains(document.contentHash());
        }

        @Test
        @DisplayName("A file deleted while its chunks are embedded should not be written")
        void deletedFileShouldNotBeWritten() throws IOException {
            // Given: an earlier version is stored
            pipeline.process(List.of(document("a.py", "version one")), 1);
            final SourceDocument changed = document("a.py", "version two");
            backend.beforeEmbed(text -> {
                try {
                    Files.deleteIfExists(changed.absolutePath());
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
            });

            // When
            final BatchResult result = pipeline.process(List.of(changed), 2);

            // Then
            assertThat(result.documentsIndexed()).isZero();
            assertThat(result.documentsSkipped()).isEqualTo(1);
            assertThat(store.documentIds()).isEmpty();
        }

        @Test
        @DisplayName("One failing document should not affect the rest of the batch")
        void shouldIsolateDocumentFailures() throws IOException {
            backend.failFatally(text -> text.contains("broken"));

            final BatchResult result = pipeline.process(
                    List.of(document("a.py", "fine one"), document("b.py", "broken"), document("c.py", "fine two")), 1);

            assertThat(result.documentsIndexed()).isEqualTo(2);
            assertThat(result.documentsFailed()).isEqualTo(1);
            assertThat(store.documentIds()).containsExactly("a.py", "c.py");
        }
    }

    @Nested
    @DisplayName("Streaming ingestion")
    class StreamingIngestion {

        @Test
        @DisplayName("Should emit one progress event per batch and a final completion")
        void shouldStreamProgress() {
            // Given
            final List<SourceDocument> documents = IntStream.range(0, 5)
                    .mapToObj(i -> document("f" + i + ".py", "content number " + i))
                    .toList();
            final List<ProgressEvent> events = Collections.synchronizedList(new ArrayList<>());

            // When
            final IngestSummary summary = pipeline.ingest(documents, 2, events::add);

            // Then
            assertThat(events).extracting(ProgressEvent::type).containsExactly(
                    ProgressEvent.Type.PROGRESS, ProgressEvent.Type.PROGRESS, ProgressEvent.Type.PROGRESS,
                    ProgressEvent.Type.COMPLETE);
            assertThat(events.get(1).processedDocuments()).isEqualTo(4);
            assertThat(events.get(2).totalBatches()).isEqualTo(3);
            assertThat(summary.batches()).isEqualTo(3);
            assertThat(summary.documentsIndexed()).isEqualTo(5);
        }

        @Test
        @DisplayName("A failing listener should not interrupt ingestion")
        void failingListenerShouldNotInterrupt() {
            final List<SourceDocument> documents = List.of(document("a.py", "one"), document("b.py", "two"));

            final IngestSummary summary = pipeline.ingest(documents, 1, event -> {
                throw new IllegalStateException("listener broken");
            });

            assertThat(summary.documentsIndexed()).isEqualTo(2);
        }

        @Test
        @DisplayName("An aborted run should end with an error event")
        void abortedRunShouldEmitError() throws IOException {
            store.bindEmbeddingModel("other-model", 8);
            store.upsert(new StoredChunk("x.py#0", "x.py", 0, "/work/x.py", "text",
                    new HashingEmbeddingBackend(8).embed("text"), "h", Map.of()));
            final List<ProgressEvent> events = new ArrayList<>();

            final IngestSummary summary = pipeline.ingest(List.of(document("a.py", "one")), 1, events::add);

            assertThat(events).singleElement().satisfies(event -> {
                assertThat(event.type()).isEqualTo(ProgressEvent.Type.ERROR);
                assertThat(event.message()).contains("other-model");
            });
            assertThat(summary.documentsIndexed()).isZero();
        }
    }

    /**
     * Hashing vectors with scripted failures; safe to call from the embedding workers.
     */
    private static final class ScriptedBackend implements EmbeddingBackend {

        private final HashingEmbeddingBackend vectors = new HashingEmbeddingBackend(8);
        private final AtomicInteger calls = new AtomicInteger();
        private final Map<String, AtomicInteger> failuresByText = new ConcurrentHashMap<>();
        private volatile Predicate<String> transientFailures = text -> false;
        private volatile int transientFailureCount;
        private volatile Predicate<String> fatalFailures = text -> false;
        private volatile Consumer<String> beforeEmbed = text -> {
        };

        void failTransiently(final Predicate<String> which, final int times) {
            transientFailures = which;
            transientFailureCount = times;
        }

        void failFatally(final Predicate<String> which) {
            fatalFailures = which;
        }

        void beforeEmbed(final Consumer<String> hook) {
            beforeEmbed = hook;
        }

        int calls() {
            return calls.get();
        }

        @Override
        public float[] embed(final String text) {
            calls.incrementAndGet();
            beforeEmbed.accept(text);
            if (fatalFailures.test(text)) {
                throw EmbeddingException.fatal("rejected: " + text);
            }
            if (transientFailures.test(text)) {
                final int failed = failuresByText.computeIfAbsent(text, t -> new AtomicInteger()).getAndIncrement();
                if (failed < transientFailureCount) {
                    throw new EmbeddingException("timeout", true);
                }
            }
            return vectors.embed(text);
        }

        @Override
        public String modelId() {
            return "scripted";
        }

        @Override
        public int dimension() {
            return 8;
        }
    }
}
