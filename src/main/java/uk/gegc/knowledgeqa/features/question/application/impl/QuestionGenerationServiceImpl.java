package uk.gegc.knowledgeqa.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.ai.application.AiPipelineMetrics;
import uk.gegc.knowledgeqa.features.ai.application.GenerationModelClient;
import uk.gegc.knowledgeqa.features.ai.application.PromptTemplateService;
import uk.gegc.knowledgeqa.features.ai.infra.parser.ResponseSanitizer;
import uk.gegc.knowledgeqa.features.knowledgebase.application.FragmentRetriever;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.question.application.QuestionGenerationService;
import uk.gegc.knowledgeqa.features.question.application.QuestionRequest;
import uk.gegc.knowledgeqa.features.question.application.QuestionValidator;
import uk.gegc.knowledgeqa.features.question.application.RecentQuestionRegistry;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.features.question.infra.parser.GeneratedQuestionParser;
import uk.gegc.knowledgeqa.features.question.infra.parser.ParsedQuestion;
import uk.gegc.knowledgeqa.features.selection.application.ContentSelector;
import uk.gegc.knowledgeqa.features.selection.application.SelectionSession;
import uk.gegc.knowledgeqa.features.selection.application.SelectionSessionRegistry;
import uk.gegc.knowledgeqa.features.selection.domain.model.SelectionStrategy;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.CallTimeoutException;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;
import uk.gegc.knowledgeqa.shared.exception.ModelResponseException;
import uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;
import uk.gegc.knowledgeqa.shared.exception.QuestionGenerationException;
import uk.gegc.knowledgeqa.shared.retry.AttemptResult;
import uk.gegc.knowledgeqa.shared.retry.BoundedRetryExecutor;
import uk.gegc.knowledgeqa.shared.retry.RetryOutcome;
import uk.gegc.knowledgeqa.shared.util.TimeLimitedCaller;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionGenerationServiceImpl implements QuestionGenerationService {

    /**
     * Fragments retrieved for a topic, each yielding at most one suggestion
     */
    static final int SUGGESTION_COUNT = 3;

    private final KnowledgeBaseCatalog catalog;
    private final ContentSelector contentSelector;
    private final FragmentRetriever fragmentRetriever;
    private final SelectionSessionRegistry sessionRegistry;
    private final PromptTemplateService promptTemplateService;
    private final GenerationModelClient modelClient;
    private final ResponseSanitizer responseSanitizer;
    private final GeneratedQuestionParser questionParser;
    private final QuestionValidator questionValidator;
    private final RecentQuestionRegistry recentQuestions;
    private final BoundedRetryExecutor retryExecutor;
    private final TimeLimitedCaller timeLimitedCaller;
    private final AiPipelineMetrics metrics;
    private final KnowledgeQaProperties properties;
    private final Clock clock;

    @Override
    public Question generate(String kbName, Difficulty difficulty, SelectionStrategy strategy) {
        return generate(QuestionRequest.of(kbName, difficulty, strategy));
    }

    @Override
    public Question generate(QuestionRequest request) {
        String kbName = request.kbName();
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }

        Difficulty difficulty = request.difficulty() != null ? request.difficulty() : properties.getDefaultDifficulty();
        SelectionStrategy strategy = request.strategy() != null ? request.strategy() : properties.getDefaultStrategy();
        long startTime = System.currentTimeMillis();

        SelectionSession session = sessionRegistry.session(request.sessionId());
        ContentFragment fragment = contentSelector.select(kbName, strategy, difficulty, session);

        Question question = generateFrom(kbName, fragment, difficulty, strategy, request.cancellationChecker());

        contentSelector.recordUse(kbName, fragment, session);
        metrics.recordQuestionLatency(kbName, System.currentTimeMillis() - startTime);
        return question;
    }

    private Question generateFrom(String kbName,
                                  ContentFragment fragment,
                                  Difficulty difficulty,
                                  SelectionStrategy strategy,
                                  BooleanSupplier cancellationChecker) {
        String sourceContext = truncateFromEnd(fragment.text(), properties.getMaxContextLength());

        AtomicReference<String> lastRawOutput = new AtomicReference<>();
        RetryOutcome<ParsedQuestion> outcome = retryExecutor.run(
                "Question generation for '" + kbName + "'",
                cancellationChecker,
                attempt -> attemptGeneration(kbName, sourceContext, difficulty, attempt, lastRawOutput));

        if (!outcome.isSuccess()) {
            metrics.incrementQuestionFailed(kbName, outcome.getAttempts());
            AttemptResult<ParsedQuestion> lastFailure = outcome.getLastFailure();
            String rawOutput = lastFailure.getRawOutput() != null ? lastFailure.getRawOutput() : lastRawOutput.get();
            throw new QuestionGenerationException(kbName, outcome.getAttempts(), rawOutput, lastFailure.getCause());
        }

        ParsedQuestion parsed = outcome.getValue();
        Question question = Question.builder()
                .id(UUID.randomUUID())
                .content(parsed.question())
                .kbName(kbName)
                .sourceContext(sourceContext)
                .difficulty(difficulty)
                .createdAt(Instant.now(clock))
                .backgroundInfo(parsed.background())
                .sourceId(fragment.sourceId())
                .fragmentId(fragment.id())
                .strategy(strategy)
                .build();

        recentQuestions.register(kbName, question.content());
        metrics.incrementQuestionGenerated(kbName, outcome.getAttempts());
        log.info("Generated {} question {} for '{}' from fragment {} in {} attempt(s)",
                difficulty, question.id(), kbName, fragment.id(), outcome.getAttempts());
        return question;
    }

    private AttemptResult<ParsedQuestion> attemptGeneration(String kbName,
                                                            String sourceContext,
                                                            Difficulty difficulty,
                                                            int attempt,
                                                            AtomicReference<String> lastRawOutput) {
        KnowledgeQaProperties.Generation generation = properties.getGeneration();
        double temperature = Math.min(
                generation.getTemperature() + generation.getTemperatureStep() * (attempt - 1),
                generation.getMaxTemperature());
        String prompt = promptTemplateService.buildQuestionPrompt(sourceContext, difficulty, attempt);

        String rawOutput;
        try {
            rawOutput = timeLimitedCaller.call("Question generation model call", generation.getModelTimeout(),
                    () -> modelClient.complete(prompt, temperature, generation.getMaxTokens()));
        } catch (CallTimeoutException e) {
            metrics.incrementQuestionAttemptRejected(kbName, "timeout");
            return AttemptResult.failure(e.getMessage(), null, e);
        } catch (ModelUnavailableException | ModelResponseException e) {
            metrics.incrementQuestionAttemptRejected(kbName, "model-error");
            return AttemptResult.failure(e.getMessage(), null, e);
        }
        lastRawOutput.set(rawOutput);

        String sanitized = responseSanitizer.sanitize(rawOutput);
        ParsedQuestion parsed = questionParser.parse(sanitized);

        Optional<String> rejection = questionValidator.validate(kbName, parsed.question());
        if (rejection.isPresent()) {
            metrics.incrementQuestionAttemptRejected(kbName, "validation");
            return AttemptResult.failure(rejection.get(), rawOutput);
        }
        return AttemptResult.success(parsed);
    }

    @Override
    public List<Question> generateMultiple(String kbName, int count, Difficulty difficulty, SelectionStrategy strategy) {
        if (count <= 0) {
            return List.of();
        }
        List<Question> questions = new ArrayList<>();
        int failures = 0;
        while (questions.size() < count && failures < count) {
            try {
                questions.add(generate(kbName, difficulty, strategy));
            } catch (QuestionGenerationException e) {
                failures++;
                log.warn("Skipping failed question {}/{} for '{}': {}", questions.size() + failures, count,
                        kbName, e.getMessage());
            }
        }
        log.info("Generated {}/{} questions for '{}' ({} failures)", questions.size(), count, kbName, failures);
        return questions;
    }

    @Override
    public List<Question> questionSuggestions(String kbName, String topic) {
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }
        if (topic == null || topic.isBlank()) {
            return List.of();
        }

        KnowledgeQaProperties.Retrieval retrieval = properties.getRetrieval();
        List<ContentFragment> hits;
        try {
            hits = timeLimitedCaller.call("Suggestion retrieval", retrieval.getTimeout(),
                    () -> fragmentRetriever.similaritySearch(kbName, topic.strip(), SUGGESTION_COUNT));
        } catch (KnowledgeBaseNotFoundException | PipelineCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to retrieve content for suggestions on '{}' in '{}': {}", topic, kbName, e.getMessage());
            return List.of();
        }

        List<Question> suggestions = new ArrayList<>();
        for (ContentFragment hit : hits) {
            try {
                suggestions.add(generateFrom(kbName, hit, Difficulty.MEDIUM, null, null));
            } catch (QuestionGenerationException e) {
                log.warn("Skipping suggestion from fragment {}: {}", hit.id(), e.getMessage());
            }
        }
        log.info("Suggested {}/{} questions on '{}' for '{}'", suggestions.size(), hits.size(), topic, kbName);
        return suggestions;
    }

    @Override
    public void clearQuestionHistory(String kbName) {
        recentQuestions.clear(kbName);
        log.info("Cleared recent question history for '{}'", kbName);
    }

    @Override
    public int questionHistoryCount(String kbName) {
        return recentQuestions.count(kbName);
    }

    /**
     * Keeps the opening of the text, never splitting a surrogate pair.
     */
    static String truncateFromEnd(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
