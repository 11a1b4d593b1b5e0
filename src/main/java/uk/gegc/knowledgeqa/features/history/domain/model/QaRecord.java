package uk.gegc.knowledgeqa.features.history.domain.model;

import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationStatus;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One answered question as handed to the history store.
 */
public record QaRecord(
        UUID id,
        Question question,
        String userAnswer,
        EvaluationResult evaluation,
        Instant recordedAt
) {

    public QaRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(evaluation, "evaluation");
        Objects.requireNonNull(recordedAt, "recordedAt");
        userAnswer = userAnswer == null ? "" : userAnswer;
    }

    public static QaRecord of(Question question, String userAnswer, EvaluationResult evaluation, Instant recordedAt) {
        return new QaRecord(UUID.randomUUID(), question, userAnswer, evaluation, recordedAt);
    }

    public String kbName() {
        return question.kbName();
    }

    public EvaluationStatus status() {
        return evaluation.status();
    }
}
