package de.mirkosertic.codeindex.store;

import java.util.Map;

/**
 * A nearest neighbour hit. {@code score} is the cosine similarity in [-1, 1].
 */
public record VectorMatch(
        String chunkId,
        String documentId,
        int chunkIndex,
        String sourcePath,
        String text,
        double score,
        Map<String, String> metadata
) {
}
