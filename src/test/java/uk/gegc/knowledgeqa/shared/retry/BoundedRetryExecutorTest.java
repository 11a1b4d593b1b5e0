package uk.gegc.knowledgeqa.shared.retry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.knowledgeqa.shared.config.AiRetryConfig;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BoundedRetryExecutor")
class BoundedRetryExecutorTest {

    private AiRetryConfig config;
    private BoundedRetryExecutor executor;

    @BeforeEach
    void setUp() {
        config = new AiRetryConfig();
        config.setMaxRetries(3);
        config.setBaseDelayMs(0);
        executor = new BoundedRetryExecutor(config);
    }

    @Test
    @DisplayName("stops at the first successful attempt")
    void returnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<String> outcome = executor.run("test", null, attempt -> {
            calls.incrementAndGet();
            return attempt < 2 ? AttemptResult.failure("bad", "raw-" + attempt) : AttemptResult.success("ok");
        });

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).isEqualTo("ok");
        assertThat(outcome.getAttempts()).isEqualTo(2);
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("makes exactly max-retries attempts and keeps the last failure")
    void exhaustsBudget() {
        AtomicInteger calls = new AtomicInteger();

        RetryOutcome<String> outcome = executor.run("test", null, attempt -> {
            calls.incrementAndGet();
            return AttemptResult.failure("bad " + attempt, "raw-" + attempt);
        });

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(calls).hasValue(3);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getLastFailure().getFailureReason()).isEqualTo("bad 3");
        assertThat(outcome.getLastFailure().getRawOutput()).isEqualTo("raw-3");
    }

    @Test
    @DisplayName("counts a failure without a message as a failure")
    void failureWithoutMessage() {
        RetryOutcome<String> outcome = executor.run("test", null,
                attempt -> AttemptResult.failure(null, null, new IllegalStateException()));

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getLastFailure().getFailureReason()).isEqualTo("IllegalStateException");
    }

    @Test
    @DisplayName("aborts before the next attempt once cancelled")
    void cancellationAbortsLoop() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.run("test", () -> calls.get() >= 1, attempt -> {
            calls.incrementAndGet();
            return AttemptResult.failure("bad", null);
        })).isInstanceOf(PipelineCancelledException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("treats an interrupted thread as cancelled")
    void interruptedThreadIsCancelled() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> executor.run("test", null, attempt -> AttemptResult.success("never")))
                    .isInstanceOf(PipelineCancelledException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("backoff grows exponentially and is capped")
    void backoffIsBounded() {
        config.setBaseDelayMs(100);
        config.setMaxDelayMs(1000);
        config.setJitterFactor(0.0);

        assertThat(executor.calculateBackoffDelay(0)).isEqualTo(100);
        assertThat(executor.calculateBackoffDelay(2)).isEqualTo(400);
        assertThat(executor.calculateBackoffDelay(10)).isEqualTo(1000);
    }
}
