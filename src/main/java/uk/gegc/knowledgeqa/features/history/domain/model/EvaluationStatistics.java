package uk.gegc.knowledgeqa.features.history.domain.model;

import java.util.Map;

/**
 * Aggregate view over a set of answered questions.
 *
 * @param accuracyRate       percentage of records marked correct, over all records
 * @param averageScore       mean score of the records that were actually graded
 * @param scoreDistribution  counts per score bucket, highest bucket first
 * @param statusDistribution counts per evaluation status
 */
public record EvaluationStatistics(
        int totalQuestions,
        int correctAnswers,
        double accuracyRate,
        double averageScore,
        Map<String, Integer> scoreDistribution,
        Map<String, Integer> statusDistribution
) {
}
