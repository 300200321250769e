package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.embedding.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff. Attempt {@code n} (1-based) that fails transiently is followed by a
 * pause of {@code base * 2^(n-1)}, capped at {@code max}. Transient embedding failures and I/O
 * failures are retried, anything else is fatal.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(final int maxAttempts, final Duration baseDelay, final Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * @throws RetryExhaustedException when the last attempt failed or a failure was fatal
     * @throws InterruptedException    when interrupted during a backoff pause
     */
    public <T> T execute(final Supplier<T> call, final String description) throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (final RuntimeException e) {
                final boolean retryable = isRetryable(e);
                if (!retryable || attempt >= maxAttempts) {
                    throw new RetryExhaustedException(description, attempt, e);
                }
                final Duration delay = delayAfter(attempt);
                logger.debug("{} failed on attempt {}/{}, retrying in {}ms: {}",
                        description, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    Duration delayAfter(final int attempt) {
        final long factor = 1L << Math.min(attempt - 1, 30);
        final long millis = baseDelay.toMillis() * factor;
        return millis < 0 || millis > maxDelay.toMillis() ? maxDelay : Duration.ofMillis(millis);
    }

    static boolean isRetryable(final RuntimeException e) {
        if (e instanceof EmbeddingException embeddingException) {
            return embeddingException.isTransient();
        }
        return e instanceof UncheckedIOException;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Final failure of a retried call.
     */
    public static class RetryExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryExhaustedException(final String description, final int attempts, final RuntimeException cause) {
            super(description + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
