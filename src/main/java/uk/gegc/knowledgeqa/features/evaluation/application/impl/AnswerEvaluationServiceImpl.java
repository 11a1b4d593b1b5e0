package uk.gegc.knowledgeqa.features.evaluation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.ai.application.AiPipelineMetrics;
import uk.gegc.knowledgeqa.features.ai.application.GenerationModelClient;
import uk.gegc.knowledgeqa.features.ai.application.PromptTemplateService;
import uk.gegc.knowledgeqa.features.ai.infra.parser.ResponseSanitizer;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerEvaluationService;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerSubmission;
import uk.gegc.knowledgeqa.features.evaluation.application.AnswerValidator;
import uk.gegc.knowledgeqa.features.evaluation.application.EvaluationContextAssembler;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationResult;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationStatus;
import uk.gegc.knowledgeqa.features.evaluation.infra.parser.EvaluationResponseParser;
import uk.gegc.knowledgeqa.features.evaluation.infra.parser.ParsedEvaluation;
import uk.gegc.knowledgeqa.features.knowledgebase.application.FragmentRetriever;
import uk.gegc.knowledgeqa.features.knowledgebase.application.KnowledgeBaseCatalog;
import uk.gegc.knowledgeqa.features.knowledgebase.domain.model.ContentFragment;
import uk.gegc.knowledgeqa.features.question.domain.model.Question;
import uk.gegc.knowledgeqa.shared.config.KnowledgeQaProperties;
import uk.gegc.knowledgeqa.shared.exception.CallTimeoutException;
import uk.gegc.knowledgeqa.shared.exception.EvaluationParseException;
import uk.gegc.knowledgeqa.shared.exception.KnowledgeBaseNotFoundException;
import uk.gegc.knowledgeqa.shared.exception.ModelResponseException;
import uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;
import uk.gegc.knowledgeqa.shared.retry.AttemptResult;
import uk.gegc.knowledgeqa.shared.retry.BoundedRetryExecutor;
import uk.gegc.knowledgeqa.shared.retry.RetryOutcome;
import uk.gegc.knowledgeqa.shared.util.TimeLimitedCaller;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerEvaluationServiceImpl implements AnswerEvaluationService {

    private final KnowledgeBaseCatalog catalog;
    private final FragmentRetriever fragmentRetriever;
    private final EvaluationContextAssembler contextAssembler;
    private final AnswerValidator answerValidator;
    private final PromptTemplateService promptTemplateService;
    private final GenerationModelClient modelClient;
    private final ResponseSanitizer responseSanitizer;
    private final EvaluationResponseParser responseParser;
    private final BoundedRetryExecutor retryExecutor;
    private final TimeLimitedCaller timeLimitedCaller;
    private final AiPipelineMetrics metrics;
    private final KnowledgeQaProperties properties;

    @Override
    public EvaluationResult evaluate(Question question, String userAnswer, String kbName) {
        return evaluate(question, userAnswer, kbName, null);
    }

    @Override
    public EvaluationResult evaluate(Question question,
                                     String userAnswer,
                                     String kbName,
                                     BooleanSupplier cancellationChecker) {
        Objects.requireNonNull(question, "question");
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }

        List<String> issues = answerValidator.validate(userAnswer);
        if (!issues.isEmpty()) {
            log.info("Answer to question {} rejected before evaluation: {}", question.id(), issues);
            metrics.incrementAnswerRejected(kbName);
            return EvaluationResult.invalidAnswer(issues);
        }

        long startTime = System.currentTimeMillis();
        String answer = userAnswer.strip();
        AtomicReference<String> referenceContext = new AtomicReference<>();

        RetryOutcome<ParsedEvaluation> outcome;
        EvaluationResult result;
        try {
            outcome = retryExecutor.run(
                    "Answer evaluation for question " + question.id(),
                    cancellationChecker,
                    attempt -> attemptEvaluation(question, answer, kbName, referenceContext));
            if (!outcome.isSuccess()) {
                metrics.incrementEvaluationDegraded(kbName, outcome.getAttempts());
                return EvaluationResult.degraded(outcome.getLastFailure().getFailureReason());
            }
            result = toResult(question, outcome.getValue());
        } catch (KnowledgeBaseNotFoundException | PipelineCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error while evaluating answer to question {}", question.id(), e);
            metrics.incrementEvaluationDegraded(kbName, 0);
            return EvaluationResult.degraded(String.valueOf(e.getMessage()));
        }

        metrics.incrementEvaluationCompleted(kbName, result.correct());
        metrics.recordEvaluationLatency(kbName, System.currentTimeMillis() - startTime);
        log.info("Evaluated answer to question {}: score {} (correct: {}) in {} attempt(s)",
                question.id(), result.score(), result.correct(), outcome.getAttempts());
        return result;
    }

    @Override
    public List<EvaluationResult> evaluateMultiple(List<AnswerSubmission> submissions, String kbName) {
        if (!catalog.exists(kbName)) {
            throw new KnowledgeBaseNotFoundException("Knowledge base '" + kbName + "' does not exist");
        }
        if (submissions == null || submissions.isEmpty()) {
            return List.of();
        }
        log.info("Evaluating {} answers for '{}'", submissions.size(), kbName);

        List<EvaluationResult> results = new ArrayList<>(submissions.size());
        for (int i = 0; i < submissions.size(); i++) {
            AnswerSubmission submission = submissions.get(i);
            try {
                results.add(evaluate(submission.question(), submission.answer(), kbName));
            } catch (PipelineCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to evaluate answer {}/{} for '{}': {}", i + 1, submissions.size(), kbName,
                        e.getMessage());
                results.add(EvaluationResult.degraded(String.valueOf(e.getMessage())));
            }
        }
        log.info("Completed batch evaluation for '{}': {} results", kbName, results.size());
        return results;
    }

    private AttemptResult<ParsedEvaluation> attemptEvaluation(Question question,
                                                              String answer,
                                                              String kbName,
                                                              AtomicReference<String> referenceContext) {
        if (referenceContext.get() == null) {
            KnowledgeQaProperties.Retrieval retrieval = properties.getRetrieval();
            try {
                List<ContentFragment> retrieved = timeLimitedCaller.call("Context retrieval", retrieval.getTimeout(),
                        () -> fragmentRetriever.similaritySearch(kbName, question.content(), retrieval.getTopK()));
                referenceContext.set(contextAssembler.assemble(question, retrieved, properties.getMaxContextLength()));
            } catch (KnowledgeBaseNotFoundException | PipelineCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                return AttemptResult.failure("context retrieval failed: " + e.getMessage(), null, e);
            }
        }

        KnowledgeQaProperties.Evaluation evaluation = properties.getEvaluation();
        String prompt = promptTemplateService.buildEvaluationPrompt(question.content(), answer,
                referenceContext.get(), evaluation.getCorrectnessThreshold());

        String rawOutput;
        try {
            rawOutput = timeLimitedCaller.call("Answer evaluation model call", evaluation.getModelTimeout(),
                    () -> modelClient.complete(prompt, evaluation.getTemperature(), evaluation.getMaxTokens()));
        } catch (CallTimeoutException | ModelUnavailableException | ModelResponseException e) {
            return AttemptResult.failure(e.getMessage(), null, e);
        }

        try {
            return AttemptResult.success(responseParser.parse(responseSanitizer.sanitize(rawOutput)));
        } catch (EvaluationParseException e) {
            return AttemptResult.failure(e.getMessage(), rawOutput, e);
        }
    }

    private EvaluationResult toResult(Question question, ParsedEvaluation parsed) {
        boolean correct = parsed.score() >= properties.getEvaluation().getCorrectnessThreshold();
        if (correct != parsed.verdict()) {
            log.info("Model verdict ({}) disagrees with score {} for question {}; using the score",
                    parsed.verdict() ? "correct" : "incorrect", parsed.score(), question.id());
        }
        return EvaluationResult.builder()
                .correct(correct)
                .score(parsed.score())
                .feedback(parsed.feedback())
                .missingPoints(parsed.missingPoints())
                .strengths(parsed.strengths())
                .referenceAnswer(parsed.referenceAnswer())
                .status(EvaluationStatus.EVALUATED)
                .build();
    }
}
