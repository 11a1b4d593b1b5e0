package uk.gegc.knowledgeqa.shared.exception;

/**
 * Exception thrown when a knowledge base name is unknown to the catalog
 */
public class KnowledgeBaseNotFoundException extends RuntimeException {

    public KnowledgeBaseNotFoundException(String message) {
        super(message);
    }

    public KnowledgeBaseNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
