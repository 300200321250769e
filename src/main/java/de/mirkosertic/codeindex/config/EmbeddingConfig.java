package de.mirkosertic.codeindex.config;

import java.time.Duration;

public record EmbeddingConfig(String provider, String url, String model, int dimension, Duration timeout,
                              int cacheSize) {
}
