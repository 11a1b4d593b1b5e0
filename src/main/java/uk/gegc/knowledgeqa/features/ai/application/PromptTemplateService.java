package uk.gegc.knowledgeqa.features.ai.application;

import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;

/**
 * Service for building the question generation and answer evaluation prompts
 */
public interface PromptTemplateService {

    /**
     * Build a prompt asking for one question about the given knowledge content
     *
     * @param content    fragment text, already truncated to the context budget
     * @param difficulty difficulty whose rubric is embedded in the prompt
     * @param attempt    1-based attempt number; later attempts add corrective instructions
     * @return Formatted prompt string for the model
     */
    String buildQuestionPrompt(String content, Difficulty difficulty, int attempt);

    /**
     * Build a prompt asking the model to grade an answer in the tagged evaluation format
     *
     * @param question             the question text
     * @param userAnswer           the free-text answer
     * @param referenceContext     combined reference material
     * @param correctnessThreshold score at or above which the answer counts as correct
     * @return Formatted prompt string for the model
     */
    String buildEvaluationPrompt(String question, String userAnswer, String referenceContext, double correctnessThreshold);

    /**
     * Load a prompt template from resources
     *
     * @param templateName The name of the template file under {@code prompts/}
     * @return The template content
     */
    String loadPromptTemplate(String templateName);
}
