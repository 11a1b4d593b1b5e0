package uk.gegc.knowledgeqa.features.evaluation.application;

import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Grades free-text answers against a question's source material.
 *
 * <p>Grading failures never surface as exceptions: when the model cannot be reached or its
 * response cannot be parsed within the retry budget, an {@code UNEVALUATED} result is returned.
 * Only an unknown knowledge base and cancellation are raised to the caller.</p>
 */
public interface AnswerEvaluationService {

    EvaluationResult evaluate(Question question, String userAnswer, String kbName);

    /**
     * @param cancellationChecker returns true once the caller has given up; may be null
     */
    EvaluationResult evaluate(Question question, String userAnswer, String kbName, BooleanSupplier cancellationChecker);

    /**
     * Grade several answers one after another. A failure on one submission yields an
     * {@code UNEVALUATED} result in its position and the batch carries on.
     *
     * @return one result per submission, in submission order
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base does not exist
     */
    List<EvaluationResult> evaluateMultiple(List<AnswerSubmission> submissions, String kbName);
}
