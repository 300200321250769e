package de.mirkosertic.codeindex.query;

import java.util.List;

/**
 * Hits ordered by descending score, with the time spent embedding the query and searching the
 * store reported separately.
 */
public record SearchResponse(
        String query,
        List<SearchHit> hits,
        long embeddingTimeMs,
        long searchTimeMs
) {

    public SearchResponse {
        hits = List.copyOf(hits);
    }

    public long totalTimeMs() {
        return embeddingTimeMs + searchTimeMs;
    }
}
