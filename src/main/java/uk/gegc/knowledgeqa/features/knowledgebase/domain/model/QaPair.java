package uk.gegc.knowledgeqa.features.knowledgebase.domain.model;

/**
 * A question/answer pair extracted from a fragment at ingestion time.
 */
public record QaPair(String question, String answer) {
}
