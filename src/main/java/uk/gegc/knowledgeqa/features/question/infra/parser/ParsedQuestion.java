package uk.gegc.knowledgeqa.features.question.infra.parser;

/**
 * Question text and optional background extracted from model output.
 */
public record ParsedQuestion(String question, String background) {
}
