package uk.gegc.knowledgeqa.features.drill.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "QuestionDto", description = "A generated drill question")
public record QuestionDto(
        @Schema(description = "Question identifier, used when submitting an answer")
        UUID id,

        @Schema(description = "Question text", example = "Why is Python considered suitable for beginners?")
        String content,

        @Schema(description = "Knowledge base the question was generated from", example = "python-basics")
        String kbName,

        @Schema(description = "Reference text the question was generated from")
        String sourceContext,

        @Schema(description = "Optional background supplied with the question")
        String backgroundInfo,

        @Schema(description = "Question difficulty", example = "hard")
        Difficulty difficulty,

        @Schema(description = "Selection strategy that chose the source content", example = "random")
        SelectionStrategy strategy,

        @Schema(description = "Identifier of the source document")
        String sourceId,

        @Schema(description = "Creation time")
        Instant createdAt
) {

    public static QuestionDto from(Question question) {
        return new QuestionDto(
                question.id(),
                question.content(),
                question.kbName(),
                question.sourceContext(),
                question.backgroundInfo(),
                question.difficulty(),
                question.strategy(),
                question.sourceId(),
                question.createdAt());
    }
}
