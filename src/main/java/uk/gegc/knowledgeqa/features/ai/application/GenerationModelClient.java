package uk.gegc.knowledgeqa.features.ai.application;

/**
 * Text-completion service used by both pipelines. Isolates the provider SDK from pipeline
 * logic and makes the model trivially replaceable in tests.
 *
 * Output is returned raw: it may contain reasoning segments that callers must sanitize.
 * Implementations must be safe for concurrent use and must not retry internally; retries
 * belong to the calling pipeline's budget.
 */
public interface GenerationModelClient {

    /**
     * @param prompt      complete prompt text
     * @param temperature sampling temperature
     * @param maxTokens   upper bound on generated tokens
     * @return raw model text, never blank
     * @throws uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException if the model cannot be reached
     * @throws uk.gegc.knowledgeqa.shared.exception.ModelResponseException if the response is empty or malformed
     */
    String complete(String prompt, double temperature, int maxTokens);
}
