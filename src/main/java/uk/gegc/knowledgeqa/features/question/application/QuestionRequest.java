package uk.gegc.knowledgeqa.features.question.application;

import lombok.Builder;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.util.function.BooleanSupplier;

/**
 * Parameters of a single question generation call. Null difficulty or strategy means the
 * configured default; a null session id means the shared default selection session.
 */
@Builder
public record QuestionRequest(
        String kbName,
        Difficulty difficulty,
        SelectionStrategy strategy,
        String sessionId,
        BooleanSupplier cancellationChecker
) {

    public static QuestionRequest of(String kbName, Difficulty difficulty, SelectionStrategy strategy) {
        return new QuestionRequest(kbName, difficulty, strategy, null, null);
    }
}
