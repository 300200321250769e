package de.mirkosertic.codeindex.query;

import de.mirkosertic.codeindex.embedding.EmbeddingBackend;
import de.mirkosertic.codeindex.embedding.EmbeddingModelMismatchException;
import de.mirkosertic.codeindex.store.VectorMatch;
import de.mirkosertic.codeindex.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Similarity search over the vector store. Requests for more than {@value #MAX_TOP_K} results are
 * served with {@value #MAX_TOP_K}.
 */
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    public static final int MAX_TOP_K = 1000;

    private final EmbeddingBackend backend;
    private final VectorStore store;

    public QueryService(final EmbeddingBackend backend, final VectorStore store) {
        this.backend = backend;
        this.store = store;
    }

    /**
     * Returns at most {@code topK} chunks whose similarity to the query is at least
     * {@code threshold}, best first.
     *
     * @throws IllegalArgumentException       for a blank query, {@code topK < 1} or a threshold outside [0, 1]
     * @throws EmbeddingModelMismatchException if the store was built with another model or dimension
     * @throws IOException                     if the store cannot be searched
     */
    public SearchResponse search(final String query, final int topK, final double threshold) throws IOException {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1], got " + threshold);
        }

        final Optional<String> storeModel = store.embeddingModel();
        if (storeModel.isPresent() && !storeModel.get().equals(backend.modelId())) {
            throw new EmbeddingModelMismatchException(storeModel.get(), backend.modelId());
        }
        final OptionalInt storeDimension = store.embeddingDimension();
        if (storeDimension.isPresent() && storeDimension.getAsInt() != backend.dimension()) {
            throw new EmbeddingModelMismatchException(storeModel.orElse("") + "/" + storeDimension.getAsInt(),
                    backend.modelId() + "/" + backend.dimension());
        }
        final int limit = Math.min(topK, MAX_TOP_K);

        final long embeddingStart = System.nanoTime();
        final float[] queryVector = backend.embed(query);
        final long embeddingTimeMs = (System.nanoTime() - embeddingStart) / 1_000_000;

        final long searchStart = System.nanoTime();
        final List<VectorMatch> matches = store.search(queryVector, limit);
        final List<SearchHit> hits = matches.stream()
                .filter(match -> match.score() >= threshold)
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed())
                .limit(limit)
                .map(match -> new SearchHit(match.documentId(), match.chunkId(), match.sourcePath(),
                        match.chunkIndex(), match.text(), match.score(), match.metadata()))
                .toList();
        final long searchTimeMs = (System.nanoTime() - searchStart) / 1_000_000;

        logger.info("Query '{}' returned {} of {} candidates (threshold {}): embedding {}ms, search {}ms",
                abbreviate(query), hits.size(), matches.size(), threshold, embeddingTimeMs, searchTimeMs);
        return new SearchResponse(query, hits, embeddingTimeMs, searchTimeMs);
    }

    private static String abbreviate(final String query) {
        return query.length() <= 80 ? query : query.substring(0, 77) + "...";
    }
}
