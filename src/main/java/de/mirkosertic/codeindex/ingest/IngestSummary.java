package de.mirkosertic.codeindex.ingest;

public record IngestSummary(int totalDocuments, int batches, int documentsIndexed, int documentsFailed,
                            int chunksProcessed, int chunksFailed, long durationMs) {
}
