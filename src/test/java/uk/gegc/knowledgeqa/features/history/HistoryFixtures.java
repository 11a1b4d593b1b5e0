package uk.gegc.knowledgeqa.features.history;

import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;

import java.time.Instant;
import java.util.UUID;

public final class HistoryFixtures {

    private HistoryFixtures() {
    }

    public static Question question(String kbName) {
        return Question.builder()
                .id(UUID.randomUUID())
                .content("为什么Python适合初学者？")
                .kbName(kbName)
                .sourceContext("Python适合初学者，因为语法简单。")
                .difficulty(Difficulty.MEDIUM)
                .createdAt(Instant.EPOCH)
                .build();
    }

    public static QaRecord graded(String kbName, double score, boolean correct, Instant at) {
        EvaluationResult evaluation = EvaluationResult.builder()
                .correct(correct)
                .score(score)
                .feedback("ok")
                .build();
        return QaRecord.of(question(kbName), "因为语法简单", evaluation, at);
    }

    public static QaRecord unevaluated(String kbName, Instant at) {
        return QaRecord.of(question(kbName), "因为语法简单", EvaluationResult.degraded("timeout"), at);
    }
}
