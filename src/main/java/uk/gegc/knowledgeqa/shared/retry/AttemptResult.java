package uk.gegc.knowledgeqa.shared.retry;

/**
 * Outcome of a single pipeline attempt: either a value or a failure reason,
 * optionally with the raw model output and the exception that caused it.
 */
public final class AttemptResult<T> {

    private final boolean success;
    private final T value;
    private final String failureReason;
    private final String rawOutput;
    private final Throwable cause;

    private AttemptResult(boolean success, T value, String failureReason, String rawOutput, Throwable cause) {
        this.success = success;
        this.value = value;
        this.failureReason = failureReason;
        this.rawOutput = rawOutput;
        this.cause = cause;
    }

    public static <T> AttemptResult<T> success(T value) {
        return new AttemptResult<>(true, value, null, null, null);
    }

    public static <T> AttemptResult<T> failure(String reason, String rawOutput) {
        return new AttemptResult<>(false, null, describe(reason, null), rawOutput, null);
    }

    public static <T> AttemptResult<T> failure(String reason, String rawOutput, Throwable cause) {
        return new AttemptResult<>(false, null, describe(reason, cause), rawOutput, cause);
    }

    public boolean isSuccess() {
        return success;
    }

    private static String describe(String reason, Throwable cause) {
        if (reason != null && !reason.isBlank()) {
            return reason;
        }
        return cause != null ? cause.getClass().getSimpleName() : "unknown failure";
    }

    public T getValue() {
        return value;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getRawOutput() {
        return rawOutput;
    }

    public Throwable getCause() {
        return cause;
    }
}
