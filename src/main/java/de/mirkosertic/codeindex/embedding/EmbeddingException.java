package de.mirkosertic.codeindex.embedding;

/**
 * Failure of an embedding call. Transient failures (timeouts, throttling, server errors) may
 * succeed on retry; fatal ones (bad request, malformed response) will not.
 */
public class EmbeddingException extends RuntimeException {

    private final boolean transientFailure;

    public EmbeddingException(final String message, final boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingException(final String message, final Throwable cause, final boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static EmbeddingException transientFailure(final String message, final Throwable cause) {
        return new EmbeddingException(message, cause, true);
    }

    public static EmbeddingException fatal(final String message) {
        return new EmbeddingException(message, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
