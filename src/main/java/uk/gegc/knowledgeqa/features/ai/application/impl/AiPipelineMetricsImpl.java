package uk.gegc.knowledgeqa.features.ai.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.ai.application.AiPipelineMetrics;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer implementation of the pipeline metrics.
 * Every metric is also logged with a {@code METRIC:} prefix so it can be picked out of plain logs.
 */
@Slf4j
@Service
public class AiPipelineMetricsImpl implements AiPipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter questionGeneratedCounter;
    private final Counter questionFailedCounter;
    private final Counter evaluationCorrectCounter;
    private final Counter evaluationIncorrectCounter;
    private final Counter evaluationDegradedCounter;
    private final Counter answerRejectedCounter;

    private final Timer questionLatencyTimer;
    private final Timer evaluationLatencyTimer;

    public AiPipelineMetricsImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.questionGeneratedCounter = Counter.builder("knowledgeqa.question.generated")
                .description("Number of questions generated")
                .register(meterRegistry);
        this.questionFailedCounter = Counter.builder("knowledgeqa.question.failed")
                .description("Number of question generations that exhausted their retries")
                .register(meterRegistry);
        this.evaluationCorrectCounter = Counter.builder("knowledgeqa.evaluation.completed")
                .description("Number of answers evaluated")
                .tag("correct", "true")
                .register(meterRegistry);
        this.evaluationIncorrectCounter = Counter.builder("knowledgeqa.evaluation.completed")
                .description("Number of answers evaluated")
                .tag("correct", "false")
                .register(meterRegistry);
        this.evaluationDegradedCounter = Counter.builder("knowledgeqa.evaluation.degraded")
                .description("Number of evaluations that fell back to an unevaluated result")
                .register(meterRegistry);
        this.answerRejectedCounter = Counter.builder("knowledgeqa.evaluation.invalid-answer")
                .description("Number of answers rejected before evaluation")
                .register(meterRegistry);

        this.questionLatencyTimer = Timer.builder("knowledgeqa.question.latency")
                .description("Question generation latency including retries")
                .register(meterRegistry);
        this.evaluationLatencyTimer = Timer.builder("knowledgeqa.evaluation.latency")
                .description("Answer evaluation latency including retries")
                .register(meterRegistry);
    }

    @Override
    public void incrementQuestionGenerated(String knowledgeBase, int attempts) {
        log.info("METRIC: knowledgeqa.question.generated kb={} attempts={}", knowledgeBase, attempts);
        questionGeneratedCounter.increment();
    }

    @Override
    public void incrementQuestionFailed(String knowledgeBase, int attempts) {
        log.info("METRIC: knowledgeqa.question.failed kb={} attempts={}", knowledgeBase, attempts);
        questionFailedCounter.increment();
    }

    @Override
    public void incrementQuestionAttemptRejected(String knowledgeBase, String reason) {
        log.info("METRIC: knowledgeqa.question.attempt.rejected kb={} reason={}", knowledgeBase, reason);
        Counter.builder("knowledgeqa.question.attempt.rejected")
                .description("Number of generation attempts rejected")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementEvaluationCompleted(String knowledgeBase, boolean correct) {
        log.info("METRIC: knowledgeqa.evaluation.completed kb={} correct={}", knowledgeBase, correct);
        if (correct) {
            evaluationCorrectCounter.increment();
        } else {
            evaluationIncorrectCounter.increment();
        }
    }

    @Override
    public void incrementEvaluationDegraded(String knowledgeBase, int attempts) {
        log.info("METRIC: knowledgeqa.evaluation.degraded kb={} attempts={}", knowledgeBase, attempts);
        evaluationDegradedCounter.increment();
    }

    @Override
    public void incrementAnswerRejected(String knowledgeBase) {
        log.info("METRIC: knowledgeqa.evaluation.invalid-answer kb={}", knowledgeBase);
        answerRejectedCounter.increment();
    }

    @Override
    public void recordQuestionLatency(String knowledgeBase, long latencyMs) {
        log.info("METRIC: knowledgeqa.question.latency kb={} latencyMs={}", knowledgeBase, latencyMs);
        questionLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordEvaluationLatency(String knowledgeBase, long latencyMs) {
        log.info("METRIC: knowledgeqa.evaluation.latency kb={} latencyMs={}", knowledgeBase, latencyMs);
        evaluationLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }
}
