package uk.gegc.knowledgeqa.features.drill.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;

@Schema(name = "GenerateQuestionRequest", description = "Options for generating the next drill question; every field is optional")
public record GenerateQuestionRequest(
        @Schema(description = "Question difficulty", example = "medium")
        Difficulty difficulty,

        @Schema(description = "Content selection strategy", example = "diverse")
        SelectionStrategy strategy,

        @Schema(description = "Selection session identifier used to avoid repeating sources", example = "learner-42")
        @Size(max = 100, message = "Session id must not exceed 100 characters")
        String sessionId
) {
}
