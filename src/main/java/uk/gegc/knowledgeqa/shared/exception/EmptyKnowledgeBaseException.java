package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when a knowledge base exists but has no indexed fragments to select from
 */
public class EmptyKnowledgeBaseException extends RuntimeException {

    public EmptyKnowledgeBaseException(String message) {
        super(message);
    }

    public EmptyKnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
