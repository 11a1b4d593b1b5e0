package uk.gegc.knowledgeqa.features.drill.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "QaRecordDto", description = "An answered question with its grade")
public record QaRecordDto(
        @Schema(description = "Record identifier")
        UUID id,

        QuestionDto question,

        @Schema(description = "Submitted answer")
        String userAnswer,

        EvaluationDto evaluation,

        @Schema(description = "When the answer was recorded")
        Instant recordedAt
) {

    public static QaRecordDto from(QaRecord record) {
        return new QaRecordDto(
                record.id(),
                QuestionDto.from(record.question()),
                record.userAnswer(),
                EvaluationDto.from(record.evaluation()),
                record.recordedAt());
    }
}
