package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when an evaluation response lacks the verdict or score sections
 */
public class EvaluationParseException extends RuntimeException {

    public EvaluationParseException(String message) {
        super(message);
    }

    public EvaluationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
