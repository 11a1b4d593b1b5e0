package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when the caller cancels an in-flight generation or evaluation.
 * No partial question or evaluation is ever returned alongside it.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }

    public PipelineCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
