package uk.gegc.knowledgeqa.shared.retry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.shared.config.AiRetryConfig;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;

import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;

/**
 * Sequential retry loop with a single attempt budget taken from {@link AiRetryConfig}.
 *
 * Attempts report failures as {@link AttemptResult} values instead of throwing; only
 * cancellation and fatal errors escape an attempt. Attempts never overlap, and the loop
 * backs off exponentially with jitter between them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoundedRetryExecutor {

    private final AiRetryConfig retryConfig;

    /**
     * @param operation           name used in log messages
     * @param cancellationChecker returns true once the caller has cancelled; may be null
     * @param attempt             invoked with the 1-based attempt number
     */
    public <T> RetryOutcome<T> run(String operation,
                                   BooleanSupplier cancellationChecker,
                                   IntFunction<AttemptResult<T>> attempt) {
        int maxRetries = retryConfig.getMaxRetries();
        AttemptResult<T> lastFailure = null;

        for (int attemptNumber = 1; attemptNumber <= maxRetries; attemptNumber++) {
            checkCancelled(operation, cancellationChecker);

            AttemptResult<T> result = attempt.apply(attemptNumber);
            if (result.isSuccess()) {
                return RetryOutcome.succeeded(result.getValue(), attemptNumber);
            }

            lastFailure = result;
            log.warn("{} attempt {}/{} failed: {}", operation, attemptNumber, maxRetries, result.getFailureReason());

            if (attemptNumber < maxRetries) {
                checkCancelled(operation, cancellationChecker);
                sleepBeforeRetry(operation, calculateBackoffDelay(attemptNumber - 1));
            }
        }

        log.error("{} failed after {} attempts", operation, maxRetries);
        return RetryOutcome.exhausted(maxRetries, lastFailure);
    }

    /**
     * Calculate exponential backoff delay with jitter
     */
    long calculateBackoffDelay(int retryCount) {
        long baseDelay = retryConfig.getBaseDelayMs();
        if (baseDelay <= 0) {
            return 0;
        }
        long exponentialDelay = Math.min(baseDelay * (1L << Math.min(retryCount, 20)), retryConfig.getMaxDelayMs());

        double jitterRange = retryConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);

        return Math.min(Math.round(exponentialDelay * jitter), retryConfig.getMaxDelayMs());
    }

    private void checkCancelled(String operation, BooleanSupplier cancellationChecker) {
        if (Thread.currentThread().isInterrupted()
                || (cancellationChecker != null && cancellationChecker.getAsBoolean())) {
            log.info("{} cancelled by caller", operation);
            throw new PipelineCancelledException(operation + " cancelled by caller");
        }
    }

    private void sleepBeforeRetry(String operation, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(operation + " interrupted while waiting to retry", ie);
        }
    }
}
