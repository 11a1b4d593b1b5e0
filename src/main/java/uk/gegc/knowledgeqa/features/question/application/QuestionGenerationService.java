package uk.gegc.knowledgeqa.features.question.application;

import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.util.List;

/**
 * Generates open-ended questions from knowledge base content.
 */
public interface QuestionGenerationService {

    /**
     * Generate one question using the default selection session.
     *
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base does not exist
     * @throws uk.gegc.knowledgeqa.shared.exception.EmptyKnowledgeBaseException    if it has no content
     * @throws uk.gegc.knowledgeqa.shared.exception.QuestionGenerationException    if every attempt failed
     */
    Question generate(String kbName, Difficulty difficulty, SelectionStrategy strategy);

    /**
     * Generate one question for the given request, honouring its session and cancellation checker.
     */
    Question generate(QuestionRequest request);

    /**
     * Generate up to {@code count} questions. Individual failures are skipped; the batch stops
     * early once {@code count} generations have failed.
     */
    List<Question> generateMultiple(String kbName, int count, Difficulty difficulty, SelectionStrategy strategy);

    /**
     * Generate medium questions about {@code topic}: one per fragment retrieved for it, skipping
     * fragments the model fails on. Returns an empty list when retrieval fails or the topic is blank.
     *
     * @throws uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException if the knowledge base does not exist
     */
    List<Question> questionSuggestions(String kbName, String topic);

    /**
     * Forget the questions remembered for near-duplicate detection.
     */
    void clearQuestionHistory(String kbName);

    int questionHistoryCount(String kbName);
}
