package uk.gegc.knowledgeqa.features.question.application;

import java.util.List;

/**
 * Detailed quality check of a question.
 *
 * @param qualityScore heuristic score between 0 and 10, independent of {@code valid}
 */
public record QuestionQualityReport(
        boolean valid,
        List<String> issues,
        int length,
        boolean hasQuestionMark,
        double qualityScore
) {

    public QuestionQualityReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
