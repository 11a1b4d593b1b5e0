package uk.gegc.knowledgeqa.features.question.domain.model;

import lombok.Builder;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A generated question together with the exact reference text shown to the model when it
 * was written. Immutable once returned by the generation pipeline.
 *
 * @param sourceContext  fragment text as embedded in the generation prompt (after truncation)
 * @param backgroundInfo optional context the model supplied alongside the question
 */
@Builder
public record Question(
        UUID id,
        String content,
        String kbName,
        String sourceContext,
        Difficulty difficulty,
        Instant createdAt,
        String backgroundInfo,
        String sourceId,
        String fragmentId,
        SelectionStrategy strategy
) {

    public Question {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(kbName, "kbName");
        Objects.requireNonNull(sourceContext, "sourceContext");
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
