package de.mirkosertic.codeindex.config;

/**
 * Chunk sizing in estimated tokens.
 */
public record ChunkingConfig(int maxTokens, int minTokens, double overlapRatio) {

    public static final ChunkingConfig DEFAULTS = new ChunkingConfig(512, 100, 0.15);

    public ChunkingConfig {
        // A single word is estimated at two tokens
        if (maxTokens < 2) {
            throw new IllegalArgumentException("maxTokens must be >= 2");
        }
        if (minTokens < 0 || minTokens > maxTokens) {
            throw new IllegalArgumentException("minTokens must be between 0 and maxTokens");
        }
        if (overlapRatio < 0 || overlapRatio >= 1) {
            throw new IllegalArgumentException("overlapRatio must be in [0, 1)");
        }
    }
}
