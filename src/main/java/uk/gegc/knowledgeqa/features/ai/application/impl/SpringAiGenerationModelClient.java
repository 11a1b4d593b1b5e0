package uk.gegc.knowledgeqa.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import uk.gegc.knowledgeqa.features.ai.application.GenerationModelClient;
import uk.gegc.knowledgeqa.shared.exception.ModelResponseException;
import uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException;

/**
 * Spring AI implementation of {@link GenerationModelClient} on top of whatever {@link ChatModel}
 * the application is configured with.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiGenerationModelClient implements GenerationModelClient {

    private final ChatModel chatModel;

    @Override
    public String complete(String prompt, double temperature, int maxTokens) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt cannot be empty");
        }

        ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(new UserMessage(prompt), options));
        } catch (ModelUnavailableException | ModelResponseException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isRateLimitError(e)) {
                log.warn("Model rate limit hit: {}", e.getMessage());
                throw new ModelUnavailableException("Model rate limit exceeded: " + e.getMessage(), e);
            }
            throw new ModelUnavailableException("Model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ModelResponseException("No response received from model");
        }

        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ModelResponseException("Empty response received from model");
        }

        if (response.getMetadata() != null && response.getMetadata().getUsage() != null) {
            log.debug("Model call used {} tokens (temperature {})",
                    response.getMetadata().getUsage().getTotalTokens(), temperature);
        }
        return text;
    }

    /**
     * Check if exception is a rate limit error
     */
    private boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }

        return message.contains("429") ||
               message.contains("rate limit") ||
               message.contains("rate_limit_exceeded") ||
               message.contains("Too Many Requests");
    }
}
