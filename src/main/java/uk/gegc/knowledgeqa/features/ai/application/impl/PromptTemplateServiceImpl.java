package uk.gegc.knowledgeqa.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.ai.application.PromptTemplateService;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of PromptTemplateService backed by classpath templates under {@code prompts/}
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String QUESTION_TEMPLATE = "question/question-generation.txt";
    static final String RETRY_TEMPLATE = "question/retry-note.txt";
    static final String EVALUATION_TEMPLATE = "evaluation/answer-evaluation.txt";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildQuestionPrompt(String content, Difficulty difficulty, int attempt) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content cannot be empty");
        }
        if (difficulty == null) {
            throw new IllegalArgumentException("Difficulty cannot be null");
        }

        try {
            String template = loadPromptTemplate(QUESTION_TEMPLATE);
            String rubric = loadPromptTemplate(rubricTemplateName(difficulty)).strip();
            String retryNote = attempt > 1 ? loadPromptTemplate(RETRY_TEMPLATE).strip() : "";

            return template
                    .replace("{difficulty}", difficulty.getValue())
                    .replace("{rubric}", rubric)
                    .replace("{retryNote}", retryNote)
                    .replace("{content}", content);
        } catch (UncheckedIOException e) {
            log.error("Error building question prompt for difficulty: {}", difficulty, e);
            // Fallback to simple prompt
            return String.format("""
                    Write one %s open-ended question that tests understanding of the content below.
                    Use the language of the content and end the question with a question mark.
                    Reply as JSON: {"question": "...", "background": "..."}

                    %s
                    """, difficulty.getValue(), content);
        }
    }

    @Override
    public String buildEvaluationPrompt(String question,
                                        String userAnswer,
                                        String referenceContext,
                                        double correctnessThreshold) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question cannot be empty");
        }

        String threshold = String.format(Locale.ROOT, "%.1f", correctnessThreshold);
        try {
            return loadPromptTemplate(EVALUATION_TEMPLATE)
                    .replace("{threshold}", threshold)
                    .replace("{question}", question)
                    .replace("{userAnswer}", userAnswer == null ? "" : userAnswer)
                    .replace("{context}", referenceContext == null ? "" : referenceContext);
        } catch (UncheckedIOException e) {
            log.error("Error building evaluation prompt", e);
            return String.format("""
                    Grade the answer to the question using the reference material.
                    Reply with the sections [VERDICT] (correct or incorrect), [SCORE] (0-10, correct from %s),
                    [FEEDBACK], [MISSING_POINTS], [STRENGTHS] and [REFERENCE_ANSWER].

                    Question: %s
                    Answer: %s
                    Reference material:
                    %s
                    """, threshold, question, userAnswer, referenceContext);
        }
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load template: " + templateName, e);
        }
    }

    private String rubricTemplateName(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> "difficulty/easy.txt";
            case MEDIUM -> "difficulty/medium.txt";
            case HARD -> "difficulty/hard.txt";
        };
    }
}
