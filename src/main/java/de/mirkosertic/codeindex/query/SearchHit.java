package de.mirkosertic.codeindex.query;

import java.util.Map;

/**
 * A matching chunk. {@code score} is the cosine similarity between query and chunk.
 */
public record SearchHit(
        String documentId,
        String chunkId,
        String sourcePath,
        int chunkIndex,
        String text,
        double score,
        Map<String, String> metadata
) {
}
