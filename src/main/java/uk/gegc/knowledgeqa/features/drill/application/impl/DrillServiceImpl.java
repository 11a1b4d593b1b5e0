package uk.gegc.knowledgeqa.features.drill.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.drill.application.DrillService;
import uk.gegc.knowledgeqa.features.drill.application.IssuedQuestionCache;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerEvaluationService;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.history.application.EvaluationStatisticsCalculator;
import uk.gegc.knowledgeqa.features.history.application.QaHistoryRecorder;
import uk.gegc.knowledgeqa.features.history.domain.model.EvaluationStatistics;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.question.application.QuestionGenerationService;
import uk.gegc.knowledgeqa.features.question.application.QuestionRequest;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;
import uk.gegc.knowledgeqa.shared.exception.QuestionNotFoundException;
import uk.gegc.knowledgeqa.shared.util.TimeLimitedCaller;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DrillServiceImpl implements DrillService {

    private final QuestionGenerationService questionGenerationService;
    private final AnswerEvaluationService answerEvaluationService;
    private final QaHistoryRecorder historyRecorder;
    private final EvaluationStatisticsCalculator statisticsCalculator;
    private final IssuedQuestionCache issuedQuestions;
    private final KnowledgeBaseCatalog catalog;
    private final TimeLimitedCaller timeLimitedCaller;
    private final KnowledgeQaProperties properties;
    private final Clock clock;

    @Override
    public Question nextQuestion(String kbName, Difficulty difficulty, SelectionStrategy strategy, String sessionId) {
        Question question = questionGenerationService.generate(QuestionRequest.builder()
                .kbName(kbName)
                .difficulty(difficulty)
                .strategy(strategy)
                .sessionId(sessionId)
                .build());
        issuedQuestions.put(question);
        return question;
    }

    @Override
    public List<Question> suggestQuestions(String kbName, String topic) {
        List<Question> suggestions = questionGenerationService.questionSuggestions(kbName, topic);
        suggestions.forEach(issuedQuestions::put);
        return suggestions;
    }

    @Override
    public QaRecord submitAnswer(UUID questionId, String answer) {
        Question question = issuedQuestions.get(questionId)
                .orElseThrow(() -> new QuestionNotFoundException(questionId));

        EvaluationResult evaluation = answerEvaluationService.evaluate(question, answer, question.kbName());
        QaRecord record = QaRecord.of(question, answer, evaluation, Instant.now(clock));
        recordWithinTimeout(record);
        return record;
    }

    private void recordWithinTimeout(QaRecord record) {
        try {
            timeLimitedCaller.call("History write", properties.getHistory().getWriteTimeout(), () -> {
                historyRecorder.record(record);
                return null;
            });
        } catch (RuntimeException e) {
            log.error("Failed to record answer {} for question {}: {}",
                    record.id(), record.question().id(), e.getMessage(), e);
        }
    }

    @Override
    public List<QaRecord> history(String kbName, int limit) {
        requireKnowledgeBase(kbName);
        return historyRecorder.findByKnowledgeBase(kbName, limit);
    }

    @Override
    public EvaluationStatistics statistics(String kbName) {
        requireKnowledgeBase(kbName);
        return statisticsCalculator.calculate(historyRecorder.findByKnowledgeBase(kbName, 0));
    }

    @Override
    public int clearHistory(String kbName) {
        requireKnowledgeBase(kbName);
        questionGenerationService.clearQuestionHistory(kbName);
        return historyRecorder.deleteByKnowledgeBase(kbName);
    }

    private void requireKnowledgeBase(String kbName) {
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }
    }
}
