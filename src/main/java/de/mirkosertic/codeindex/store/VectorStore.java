package de.mirkosertic.codeindex.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Persistence and nearest neighbour search for chunk embeddings.
 */
public interface VectorStore extends AutoCloseable {

    /**
     * Inserts or replaces a single chunk, keyed by chunk id.
     */
    void upsert(StoredChunk chunk) throws IOException;

    /**
     * Replaces every chunk of the document with the given set in one step. Readers see either the
     * old set or the new one, never a mix. An empty list deletes the document.
     */
    void replaceDocument(String documentId, List<StoredChunk> chunks) throws IOException;

    /**
     * @return number of chunks removed; 0 when the document was not present
     */
    long deleteByDocument(String documentId) throws IOException;

    /**
     * Up to {@code topK} nearest chunks, best first.
     */
    List<VectorMatch> search(float[] vector, int topK) throws IOException;

    StoreStats stats() throws IOException;

    Set<String> documentIds() throws IOException;

    /**
     * Content hash recorded with the document's chunks, if the document is stored.
     */
    Optional<String> contentHash(String documentId) throws IOException;

    /**
     * Model the stored vectors were produced with, if any vectors were ever stored.
     */
    Optional<String> embeddingModel();

    /**
     * Vector dimension recorded together with {@link #embeddingModel()}.
     */
    OptionalInt embeddingDimension();

    /**
     * Records the model used for new vectors.
     *
     * @throws de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException if the store holds
     *         vectors of another model
     */
    void bindEmbeddingModel(String modelId, int dimension) throws IOException;

    /**
     * Removes all chunks.
     */
    void clear() throws IOException;

    void commit() throws IOException;

    @Override
    void close() throws IOException;
}
