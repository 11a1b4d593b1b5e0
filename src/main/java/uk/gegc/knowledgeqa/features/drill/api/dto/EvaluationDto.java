package uk.gegc.knowledgeqa.features.drill.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationStatus;

import java.util.List;

@Schema(name = "EvaluationDto", description = "Grade of a submitted answer")
public record EvaluationDto(
        @Schema(description = "Whether the answer reached the correctness threshold", example = "true")
        @JsonProperty("isCorrect")
        boolean isCorrect,

        @Schema(description = "Score from 0 to 10", example = "7.5")
        double score,

        @Schema(description = "Feedback for the learner")
        String feedback,

        @Schema(description = "Important points the answer left out")
        List<String> missingPoints,

        @Schema(description = "What the answer got right")
        List<String> strengths,

        @Schema(description = "Model answer based on the reference material")
        String referenceAnswer,

        @Schema(description = "EVALUATED, UNEVALUATED when grading failed, or INVALID_ANSWER", example = "EVALUATED")
        EvaluationStatus status
) {

    public static EvaluationDto from(EvaluationResult result) {
        return new EvaluationDto(
                result.correct(),
                result.score(),
                result.feedback(),
                result.missingPoints(),
                result.strengths(),
                result.referenceAnswer(),
                result.status());
    }
}
