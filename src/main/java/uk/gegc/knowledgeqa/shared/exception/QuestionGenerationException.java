package uk.gegc.knowledgeqa.shared.exception;

import lombok.Getter;

/**
 * Exception thrown when question generation exhausts its retry budget.
 * Carries the last raw model output (if any) for diagnostics.
 */
@Getter
public class QuestionGenerationException extends RuntimeException {

    private final String knowledgeBase;
    private final int attempts;
    private final String lastRawOutput;

    public QuestionGenerationException(String knowledgeBase, int attempts, String lastRawOutput, Throwable cause) {
        super("Could not generate a question for knowledge base '" + knowledgeBase + "' after "
                + attempts + " attempts" + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.knowledgeBase = knowledgeBase;
        this.attempts = attempts;
        this.lastRawOutput = lastRawOutput;
    }
}
