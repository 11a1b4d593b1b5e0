package uk.gegc.knowledgeqa.features.ai.application;

/**
 * Service for emitting question generation and answer evaluation metrics.
 */
public interface AiPipelineMetrics {

    /**
     * Question generation counters.
     */
    void incrementQuestionGenerated(String knowledgeBase, int attempts);
    void incrementQuestionFailed(String knowledgeBase, int attempts);
    void incrementQuestionAttemptRejected(String knowledgeBase, String reason);

    /**
     * Answer evaluation counters.
     */
    void incrementEvaluationCompleted(String knowledgeBase, boolean correct);
    void incrementEvaluationDegraded(String knowledgeBase, int attempts);
    void incrementAnswerRejected(String knowledgeBase);

    /**
     * Latency of a whole pipeline run, including retries.
     */
    void recordQuestionLatency(String knowledgeBase, long latencyMs);
    void recordEvaluationLatency(String knowledgeBase, long latencyMs);
}
