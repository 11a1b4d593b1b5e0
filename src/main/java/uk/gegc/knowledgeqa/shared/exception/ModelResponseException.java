package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when the generation model returns an empty or malformed response
 */
public class ModelResponseException extends RuntimeException {

    public ModelResponseException(String message) {
        super(message);
    }

    public ModelResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
