package uk.gegc.knowledgeqa.features.evaluation.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.knowledgeqa.features.ai.application.GenerationModelClient;
import uk.gegc.knowledgeqa.features.ai.application.impl.AiPipelineMetricsImpl;
import uk.gegc.knowledgeqa.features.ai.application.impl.PromptTemplateServiceImpl;
import uk.gegc.knowledgeqa.features.ai.infra.parser.JsonResponseExtractor;
import uk.gegc.knowledgeqa.features.ai.infra.parser.ResponseSanitizer;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerSubmission;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerValidator;
import uk.gegc.knowledgeqa.features.evaluation.application.EvaluationContextAssembler;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationStatus;
import uk.gegc.knowledgeqa.features.evaluation.infra.parser.EvaluationResponseParser;
import uk.gegc.knowledgeqa.features.knowledgebase.application.FragmentRetriever;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.knowledgebase.infra.InMemoryKnowledgeBaseStore;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.shared.config.AiRetryConfig;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;
import uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;
import uk.gegc.knowledgeqa.shared.retry.BoundedRetryExecutor;
import uk.gegc.knowledgeqa.shared.util.TimeLimitedCaller;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerEvaluationServiceImpl")
class AnswerEvaluationServiceImplTest {

    private static final String KB = "python";
    private static final String SOURCE = "Python适合初学者，因为语法简单，社区活跃。";
    private static final String GOOD_RESPONSE = """
            <think>the answer covers syntax but not the community</think>
            [VERDICT] Correct
            [SCORE] 8
            [FEEDBACK] Mentions the simple syntax.
            [MISSING_POINTS]
            - Active community
            """;

    @Mock
    private GenerationModelClient modelClient;
    @Mock
    private FragmentRetriever fragmentRetriever;

    private KnowledgeQaProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ThreadPoolTaskExecutor executor;
    private AnswerEvaluationServiceImpl service;
    private Question question;

    @BeforeEach
    void setUp() {
        InMemoryKnowledgeBaseStore store = new InMemoryKnowledgeBaseStore();
        store.register(KB, List.of(ContentFragment.of("f1", SOURCE, "doc-1")));

        properties = new KnowledgeQaProperties();
        AiRetryConfig retryConfig = new AiRetryConfig();
        retryConfig.setBaseDelayMs(0);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.initialize();
        meterRegistry = new SimpleMeterRegistry();

        service = new AnswerEvaluationServiceImpl(
                store,
                fragmentRetriever,
                new EvaluationContextAssembler(),
                new AnswerValidator(),
                new PromptTemplateServiceImpl(new DefaultResourceLoader()),
                modelClient,
                new ResponseSanitizer(),
                new EvaluationResponseParser(new JsonResponseExtractor(new ObjectMapper())),
                new BoundedRetryExecutor(retryConfig),
                new TimeLimitedCaller(executor),
                new AiPipelineMetricsImpl(meterRegistry),
                properties);

        question = Question.builder()
                .id(UUID.randomUUID())
                .content("为什么Python适合初学者？")
                .kbName(KB)
                .sourceContext(SOURCE)
                .difficulty(Difficulty.MEDIUM)
                .createdAt(Instant.EPOCH)
                .fragmentId("f1")
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("grades an answer and includes retrieved fragments in the prompt")
    void evaluatesAnswer() {
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), eq(5)))
                .thenReturn(List.of(ContentFragment.of("f7", "标准库非常丰富。", "doc-2")));
        when(modelClient.complete(anyString(), anyDouble(), anyInt())).thenReturn(GOOD_RESPONSE);

        EvaluationResult result = service.evaluate(question, "因为语法简单", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.EVALUATED);
        assertThat(result.correct()).isTrue();
        assertThat(result.score()).isEqualTo(8.0);
        assertThat(result.feedback()).isEqualTo("Mentions the simple syntax.");
        assertThat(result.missingPoints()).containsExactly("Active community");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(modelClient).complete(prompt.capture(), eq(0.3), eq(1000));
        assertThat(prompt.getValue()).contains(SOURCE, "标准库非常丰富。", "因为语法简单", "6.0");
        assertThat(meterRegistry.counter("knowledgeqa.evaluation.completed", "correct", "true").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("derives correctness from the score when the verdict disagrees")
    void scoreDecidesCorrectness() {
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt()))
                .thenReturn("[VERDICT] Correct\n[SCORE] 4\n[FEEDBACK] Partly right.");

        EvaluationResult result = service.evaluate(question, "因为社区", KB);

        assertThat(result.score()).isEqualTo(4.0);
        assertThat(result.correct()).isFalse();
    }

    @Test
    @DisplayName("honours a custom correctness threshold")
    void customThreshold() {
        properties.getEvaluation().setCorrectnessThreshold(4.0);
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt()))
                .thenReturn("[VERDICT] Incorrect\n[SCORE] 4\n[FEEDBACK] Partly right.");

        assertThat(service.evaluate(question, "因为社区", KB).correct()).isTrue();
    }

    @Test
    @DisplayName("returns an unevaluated result after repeated unparseable output")
    void degradesAfterParseFailures() {
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt())).thenReturn("Looks fine to me.");

        EvaluationResult result = service.evaluate(question, "因为语法简单", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.UNEVALUATED);
        assertThat(result.correct()).isFalse();
        assertThat(result.score()).isZero();
        assertThat(result.feedback()).contains("could not be evaluated", "missing required fields");
        verify(modelClient, times(3)).complete(anyString(), anyDouble(), anyInt());
        verify(fragmentRetriever, times(1)).similaritySearch(eq(KB), anyString(), anyInt());
        assertThat(meterRegistry.counter("knowledgeqa.evaluation.degraded").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("degrades instead of throwing when the score overflows")
    void overflowingScoreDegrades() {
        String huge = "9".repeat(400);
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt()))
                .thenReturn("[VERDICT] correct\n[SCORE] " + huge + "/" + huge);

        EvaluationResult result = service.evaluate(question, "因为语法简单", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.UNEVALUATED);
        assertThat(result.score()).isZero();
        verify(modelClient, times(3)).complete(anyString(), anyDouble(), anyInt());
    }

    @Test
    @DisplayName("recovers when a later attempt parses")
    void recoversOnRetry() {
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt()))
                .thenThrow(new ModelUnavailableException("rate limit"))
                .thenReturn("garbled")
                .thenReturn(GOOD_RESPONSE);

        EvaluationResult result = service.evaluate(question, "因为语法简单", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.EVALUATED);
        assertThat(result.score()).isEqualTo(8.0);
    }

    @Test
    @DisplayName("counts retrieval timeouts against the retry budget")
    void retrievalTimeoutsUseBudget() {
        properties.getRetrieval().setTimeout(Duration.ofMillis(50));
        doAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        }).when(fragmentRetriever).similaritySearch(eq(KB), anyString(), anyInt());

        EvaluationResult result = service.evaluate(question, "因为语法简单", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.UNEVALUATED);
        assertThat(result.feedback()).contains("context retrieval failed");
        verify(fragmentRetriever, times(3)).similaritySearch(eq(KB), anyString(), anyInt());
        verify(modelClient, never()).complete(anyString(), anyDouble(), anyInt());
    }

    @Test
    @DisplayName("rejects non-answers without calling the model")
    void invalidAnswer() {
        EvaluationResult result = service.evaluate(question, "不知道", KB);

        assertThat(result.status()).isEqualTo(EvaluationStatus.INVALID_ANSWER);
        assertThat(result.correct()).isFalse();
        assertThat(result.feedback()).contains("answer does not attempt the question");
        verifyNoInteractions(modelClient, fragmentRetriever);
        assertThat(meterRegistry.counter("knowledgeqa.evaluation.invalid-answer").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("raises for an unknown knowledge base")
    void unknownKnowledgeBase() {
        assertThatThrownBy(() -> service.evaluate(question, "因为语法简单", "missing"))
                .isInstanceOf(KnowledgeBaseNotFoundException.class);
        verifyNoInteractions(modelClient);
    }

    @Test
    @DisplayName("propagates cancellation")
    void cancellation() {
        assertThatThrownBy(() -> service.evaluate(question, "因为语法简单", KB, () -> true))
                .isInstanceOf(PipelineCancelledException.class);
        verifyNoInteractions(modelClient);
    }

    @Test
    @DisplayName("grades a batch in order and turns a failing submission into an unevaluated result")
    void evaluateMultiple() {
        when(fragmentRetriever.similaritySearch(eq(KB), anyString(), anyInt())).thenReturn(List.of());
        when(modelClient.complete(anyString(), anyDouble(), anyInt())).thenReturn(GOOD_RESPONSE);

        List<EvaluationResult> results = service.evaluateMultiple(List.of(
                new AnswerSubmission(question, "因为语法简单"),
                new AnswerSubmission(question, "不知道"),
                new AnswerSubmission(null, "因为语法简单")), KB);

        assertThat(results).extracting(EvaluationResult::status).containsExactly(
                EvaluationStatus.EVALUATED, EvaluationStatus.INVALID_ANSWER, EvaluationStatus.UNEVALUATED);
        assertThat(results.get(0).score()).isEqualTo(8.0);
        assertThat(results.get(2).correct()).isFalse();
        verify(modelClient, times(1)).complete(anyString(), anyDouble(), anyInt());
    }

    @Test
    @DisplayName("returns an empty batch for no submissions and raises for an unknown knowledge base")
    void evaluateMultipleEdges() {
        assertThat(service.evaluateMultiple(List.of(), KB)).isEmpty();
        assertThatThrownBy(() -> service.evaluateMultiple(List.of(new AnswerSubmission(question, "因为语法简单")), "missing"))
                .isInstanceOf(KnowledgeBaseNotFoundException.class);
        verifyNoInteractions(modelClient);
    }
}
