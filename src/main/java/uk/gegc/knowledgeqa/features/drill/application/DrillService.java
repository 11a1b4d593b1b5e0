package uk.gegc.knowledgeqa.features.drill.application;

import uk.gegc.knowledgeqa.features.history.domain.model.EvaluationStatistics;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.util.List;
import java.util.UUID;

/**
 * Ask-answer-record loop on top of the question and evaluation pipelines.
 */
public interface DrillService {

    /**
     * Generate a question and remember it until it is answered.
     *
     * @param sessionId selection session; null uses the shared default session
     */
    Question nextQuestion(String kbName, Difficulty difficulty, SelectionStrategy strategy, String sessionId);

    /**
     * Generate medium questions about a topic and remember them until they are answered.
     * Fragments the model fails on are skipped, so the list may be shorter than requested or empty.
     */
    List<Question> suggestQuestions(String kbName, String topic);

    /**
     * Grade an answer to a previously issued question and record the attempt.
     * The history write is bounded and its failure does not fail the call.
     *
     * @throws uk.gegc.knowledgeqa.shared.exception.QuestionNotFoundException if the question was never issued or has expired
     */
    QaRecord submitAnswer(UUID questionId, String answer);

    List<QaRecord> history(String kbName, int limit);

    EvaluationStatistics statistics(String kbName);

    /**
     * Delete the recorded history of a knowledge base and forget its recent questions.
     *
     * @return number of history records removed
     */
    int clearHistory(String kbName);
}
