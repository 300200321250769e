package de.mirkosertic.codeindex.document;

import java.util.Map;

/**
 * A bounded slice of a document. Offsets are character positions into the document content
 * (end exclusive), lines are 1-based and inclusive.
 */
public record Chunk(
        String chunkId,
        String documentId,
        int index,
        String text,
        int tokenEstimate,
        int startOffset,
        int endOffset,
        int startLine,
        int endLine,
        Map<String, String> metadata
) {

    public Chunk {
        metadata = Map.copyOf(metadata);
    }

    public static String chunkId(final String documentId, final int index) {
        return documentId + "#" + index;
    }
}
