package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when the generation model cannot be reached or rejects the call
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
