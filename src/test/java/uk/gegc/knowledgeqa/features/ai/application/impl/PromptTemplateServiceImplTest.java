package uk.gegc.knowledgeqa.features.ai.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import uk.gegc.knowledgeqa.features.question.domain.model.Difficulty;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PromptTemplateServiceImpl")
class PromptTemplateServiceImplTest {

    private final PromptTemplateServiceImpl service = new PromptTemplateServiceImpl(new DefaultResourceLoader());

    @Mock
    private ResourceLoader failingLoader;

    @Mock
    private Resource missingResource;

    @Test
    @DisplayName("embeds content and the hard rubric in the question prompt")
    void questionPromptUsesRubric() {
        String prompt = service.buildQuestionPrompt("Decorators wrap functions.", Difficulty.HARD, 1);

        assertThat(prompt)
                .contains("Decorators wrap functions.")
                .contains("Difficulty: hard")
                .contains("analyse")
                .doesNotContain("{content}")
                .doesNotContain("{rubric}")
                .doesNotContain("previous attempt was rejected");
    }

    @Test
    @DisplayName("uses different rubric text per difficulty")
    void rubricsDiffer() {
        String easy = service.buildQuestionPrompt("text", Difficulty.EASY, 1);
        String medium = service.buildQuestionPrompt("text", Difficulty.MEDIUM, 1);

        assertThat(easy).contains("single fact");
        assertThat(medium).contains("explain how or why");
    }

    @Test
    @DisplayName("adds corrective instructions on retries")
    void retryNote() {
        assertThat(service.buildQuestionPrompt("text", Difficulty.EASY, 2))
                .contains("previous attempt was rejected");
    }

    @Test
    @DisplayName("builds the tagged evaluation prompt")
    void evaluationPrompt() {
        String prompt = service.buildEvaluationPrompt("What is a tuple?", "An immutable list", "Tuples are immutable.", 6.0);

        assertThat(prompt)
                .contains("What is a tuple?")
                .contains("An immutable list")
                .contains("Tuples are immutable.")
                .contains("6.0 or more")
                .contains("[VERDICT]", "[SCORE]", "[FEEDBACK]", "[MISSING_POINTS]", "[STRENGTHS]", "[REFERENCE_ANSWER]");
    }

    @Test
    @DisplayName("falls back to an inline prompt when templates cannot be loaded")
    void fallbackPrompt() throws IOException {
        when(failingLoader.getResource(anyString())).thenReturn(missingResource);
        when(missingResource.getInputStream()).thenThrow(new IOException("missing"));
        PromptTemplateServiceImpl broken = new PromptTemplateServiceImpl(failingLoader);

        assertThat(broken.buildQuestionPrompt("Some content", Difficulty.MEDIUM, 1))
                .contains("Some content")
                .contains("medium");
    }

    @Test
    @DisplayName("rejects empty content")
    void emptyContent() {
        assertThatThrownBy(() -> service.buildQuestionPrompt(" ", Difficulty.EASY, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
