package de.mirkosertic.codeindex.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Size bounded cache in front of another backend. Keys include the model id so a model switch
 * never serves stale vectors. Failures are not cached.
 */
public class CachingEmbeddingBackend implements EmbeddingBackend {

    private final EmbeddingBackend delegate;
    private final Cache<CacheKey, float[]> cache;

    public CachingEmbeddingBackend(final EmbeddingBackend delegate, final int maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public float[] embed(final String text) {
        final float[] vector = cache.get(new CacheKey(delegate.modelId(), text), key -> delegate.embed(key.text()));
        return vector.clone();
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private record CacheKey(String model, String text) {
    }
}
