package uk.gegc.knowledgeqa.shared.exception;

import java.util.UUID;

/**
 * Exception thrown when an answer is submitted for a question id that was never issued
 * or has already been evicted from the issued-question cache.
 */
public class QuestionNotFoundException extends RuntimeException {

    public QuestionNotFoundException(UUID questionId) {
        super("Question " + questionId + " not found");
    }
}
