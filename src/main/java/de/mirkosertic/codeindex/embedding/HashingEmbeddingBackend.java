package de.mirkosertic.codeindex.embedding;

import java.util.Locale;

/**
 * Deterministic local embedding: hashed bag of words, L2 normalized. No semantic quality, but
 * identical texts map to identical vectors and overlapping vocabularies score higher, which is
 * enough for offline use and tests.
 */
public class HashingEmbeddingBackend implements EmbeddingBackend {

    private final int dimension;

    public HashingEmbeddingBackend(final int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(final String text) {
        if (text == null || text.isBlank()) {
            throw EmbeddingException.fatal("Cannot embed blank text");
        }
        final float[] vector = new float[dimension];

        boolean any = false;
        for (final String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
                any = true;
            }
        }
        if (!any) {
            // Punctuation only, fall back to whitespace tokens so the vector is never zero
            for (final String token : text.trim().split("\\s+")) {
                vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
            }
        }

        float norm = 0f;
        for (final float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }

    @Override
    public String modelId() {
        return "hashing-" + dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
