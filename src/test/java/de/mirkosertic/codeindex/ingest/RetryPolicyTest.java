package de.mirkosertic.codeindex.ingest;

import de.mirkosertic.codeindex.embedding.EmbeddingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));

    @Test
    @DisplayName("Should succeed after transient failures within the attempt cap")
    void shouldRecoverFromTransientFailures() throws InterruptedException {
        // Given
        final AtomicInteger calls = new AtomicInteger();

        // When
        final String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new EmbeddingException("timeout", true);
            }
            return "ok";
        }, "call");

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should give up after the attempt cap")
    void shouldGiveUpAfterCap() {
        final AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new EmbeddingException("still down", true);
        }, "call"))
                .isInstanceOf(RetryPolicy.RetryExhaustedException.class)
                .hasMessageContaining("after 3 attempt(s)")
                .satisfies(e -> assertThat(((RetryPolicy.RetryExhaustedException) e).getAttempts()).isEqualTo(3));
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should not retry fatal failures")
    void shouldNotRetryFatalFailures() {
        final AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw EmbeddingException.fatal("bad request");
        }, "call"))
                .isInstanceOf(RetryPolicy.RetryExhaustedException.class)
                .hasCauseInstanceOf(EmbeddingException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Should classify failures")
    void shouldClassifyFailures() {
        assertThat(RetryPolicy.isRetryable(new EmbeddingException("x", true))).isTrue();
        assertThat(RetryPolicy.isRetryable(new UncheckedIOException(new IOException("disk")))).isTrue();
        assertThat(RetryPolicy.isRetryable(EmbeddingException.fatal("x"))).isFalse();
        assertThat(RetryPolicy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    @DisplayName("Backoff should double per attempt up to the maximum")
    void backoffShouldDoubleUpToMax() {
        final RetryPolicy backoff = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofSeconds(1));

        assertThat(backoff.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.delayAfter(4)).isEqualTo(Duration.ofMillis(800));
        assertThat(backoff.delayAfter(5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayAfter(60)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should stop when interrupted during a backoff pause")
    void shouldStopWhenInterrupted() {
        final RetryPolicy slow = new RetryPolicy(3, Duration.ofSeconds(10), Duration.ofSeconds(10));
        Thread.currentThread().interrupt();

        try {
            assertThatThrownBy(() -> slow.execute(() -> {
                throw new EmbeddingException("timeout", true);
            }, "call")).isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Should reject a non-positive attempt cap")
    void shouldRejectInvalidCap() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
