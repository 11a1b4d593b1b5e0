package uk.gegc.knowledgeqa.features.ai.infra.parser;

/**
 * Result of stripping reasoning segments from model output.
 *
 * @param text                the answer text
 * @param reasoningTruncated  true when a reasoning block was never closed and was removed through end of text
 * @param failedOpen          true when removal would have left nothing and the raw text was returned instead
 */
public record SanitizedResponse(String text, boolean reasoningTruncated, boolean failedOpen) {
}
