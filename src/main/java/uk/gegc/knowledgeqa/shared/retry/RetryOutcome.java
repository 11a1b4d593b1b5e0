package uk.gegc.knowledgeqa.shared.retry;

/**
 * Result of a bounded retry loop. Carries the attempt count and, when the budget was
 * exhausted, the last failed attempt.
 */
public final class RetryOutcome<T> {

    private final T value;
    private final int attempts;
    private final AttemptResult<T> lastFailure;

    private RetryOutcome(T value, int attempts, AttemptResult<T> lastFailure) {
        this.value = value;
        this.attempts = attempts;
        this.lastFailure = lastFailure;
    }

    static <T> RetryOutcome<T> succeeded(T value, int attempts) {
        return new RetryOutcome<>(value, attempts, null);
    }

    static <T> RetryOutcome<T> exhausted(int attempts, AttemptResult<T> lastFailure) {
        return new RetryOutcome<>(null, attempts, lastFailure);
    }

    public boolean isSuccess() {
        return lastFailure == null;
    }

    public T getValue() {
        return value;
    }

    public int getAttempts() {
        return attempts;
    }

    public AttemptResult<T> getLastFailure() {
        return lastFailure;
    }
}
