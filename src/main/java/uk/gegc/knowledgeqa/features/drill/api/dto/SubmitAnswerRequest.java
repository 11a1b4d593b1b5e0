package uk.gegc.knowledgeqa.features.drill.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(name = "SubmitAnswerRequest", description = "Free-text answer to an issued question")
public record SubmitAnswerRequest(
        @Schema(description = "The learner's answer", example = "Because its syntax is simple and readable.")
        @NotNull(message = "Answer must not be null")
        String answer
) {
}
