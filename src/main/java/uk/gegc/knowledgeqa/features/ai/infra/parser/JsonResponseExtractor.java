package uk.gegc.knowledgeqa.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds a JSON object embedded in free-form model output.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonResponseExtractor {

    private static final Pattern TRAILING_COMMA_OBJECT = Pattern.compile(",\\s*}");
    private static final Pattern TRAILING_COMMA_ARRAY = Pattern.compile(",\\s*]");

    private final ObjectMapper objectMapper;

    /**
     * Returns the outermost {@code {...}} span of the text parsed as a JSON object, after removing
     * markdown code fences and trailing commas; empty when there is no parseable object.
     */
    public Optional<JsonNode> extractObject(String response) {
        if (response == null) {
            return Optional.empty();
        }
        String cleaned = cleanJsonResponse(response);
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }

        String candidate = cleaned.substring(start, end + 1);
        candidate = TRAILING_COMMA_OBJECT.matcher(candidate).replaceAll("}");
        candidate = TRAILING_COMMA_ARRAY.matcher(candidate).replaceAll("]");

        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Model output is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Clean JSON response by removing markdown code blocks
     */
    private String cleanJsonResponse(String response) {
        String cleaned = response.trim();

        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }

        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }

        return cleaned.trim();
    }
}
