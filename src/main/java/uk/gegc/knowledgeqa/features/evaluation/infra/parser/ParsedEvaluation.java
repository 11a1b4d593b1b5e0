package uk.gegc.knowledgeqa.features.evaluation.infra.parser;

import java.util.List;

/**
 * Fields read from a grading response, before the correctness threshold is applied.
 *
 * @param verdict the model's own correct/incorrect call
 * @param score   normalised to [0, 10]
 */
public record ParsedEvaluation(
        boolean verdict,
        double score,
        String feedback,
        List<String> missingPoints,
        List<String> strengths,
        String referenceAnswer
) {
}
