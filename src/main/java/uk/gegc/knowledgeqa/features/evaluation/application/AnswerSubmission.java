package uk.gegc.knowledgeqa.features.evaluation.application;

import uk.gegc.knowledgeqa.features.question.domain.model.Question;

/**
 * A question paired with the learner's answer to it.
 */
public record AnswerSubmission(Question question, String answer) {
}
