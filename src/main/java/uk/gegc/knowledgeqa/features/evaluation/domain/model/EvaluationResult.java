package uk.gegc.knowledgeqa.features.evaluation.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * Grade of a single answer. {@code correct} is always derived from {@code score} and the
 * correctness threshold in force when the result was produced.
 */
@Builder
public record EvaluationResult(
        boolean correct,
        double score,
        String feedback,
        List<String> missingPoints,
        List<String> strengths,
        String referenceAnswer,
        EvaluationStatus status
) {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    public EvaluationResult {
        if (score < MIN_SCORE || score > MAX_SCORE || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be between 0 and 10: " + score);
        }
        feedback = feedback == null ? "" : feedback;
        missingPoints = missingPoints == null ? List.of() : List.copyOf(missingPoints);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        referenceAnswer = referenceAnswer == null ? "" : referenceAnswer;
        status = Objects.requireNonNullElse(status, EvaluationStatus.EVALUATED);
    }

    /**
     * Result returned when grading failed after every attempt.
     */
    public static EvaluationResult degraded(String reason) {
        String feedback = "The answer could not be evaluated, so no grade is available. It has been recorded "
                + "as unevaluated.";
        if (reason != null && !reason.isBlank()) {
            feedback += " Reason: " + reason;
        }
        return new EvaluationResult(false, MIN_SCORE, feedback, List.of(), List.of(), "",
                EvaluationStatus.UNEVALUATED);
    }

    /**
     * Result returned for answers rejected before grading.
     */
    public static EvaluationResult invalidAnswer(List<String> issues) {
        String feedback = "The answer was not evaluated: " + String.join("; ", issues);
        return new EvaluationResult(false, MIN_SCORE, feedback, List.of(), List.of(), "",
                EvaluationStatus.INVALID_ANSWER);
    }
}
