package de.mirkosertic.codeindex.ingest;

/**
 * A chunk that could not be embedded or stored.
 */
public record ChunkFailure(String documentId, String chunkId, int attempts, String message, long timestampMs) {
}
