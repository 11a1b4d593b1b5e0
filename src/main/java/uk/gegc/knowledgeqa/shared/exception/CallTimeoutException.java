package uk.gegc.knowledgeqa.shared.exception;

import java.time.Duration;

/**
 * Exception thrown when a model or retrieval call does not finish within its configured timeout.
 * Treated as a retryable failure by the pipelines.
 */
public class CallTimeoutException extends RuntimeException {

    private final Duration timeout;

    public CallTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
