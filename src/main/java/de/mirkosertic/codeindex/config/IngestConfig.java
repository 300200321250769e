package de.mirkosertic.codeindex.config;

import java.time.Duration;

/**
 * Concurrency and retry settings for the embedding pipeline.
 */
public record IngestConfig(int concurrency, int maxAttempts, Duration backoffBase, Duration backoffMax,
                           boolean skipUnchanged) {

    public static final IngestConfig DEFAULTS =
            new IngestConfig(2, 5, Duration.ofMillis(500), Duration.ofSeconds(30), true);

    public IngestConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
    }
}
