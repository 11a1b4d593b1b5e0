package uk.gegc.knowledgeqa.features.question.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.ai.infra.parser.JsonResponseExtractor;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts the question from sanitized model output. The JSON shape
 * {@code {"question": ..., "background": ...}} is preferred; anything else is treated as
 * plain text and cleaned of labels and list numbering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeneratedQuestionParser {

    private static final Pattern LEADING_LABEL =
            Pattern.compile("^(?:\\*\\*)?(?:question|q|问题|题目)\\s*\\d*\\s*(?:\\*\\*)?\\s*[:：]\\s*(?:\\*\\*)?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBERING = Pattern.compile("^(?:\\d+\\s*[.)、]|[-*•])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final JsonResponseExtractor jsonExtractor;

    public ParsedQuestion parse(String sanitizedText) {
        if (sanitizedText == null || sanitizedText.isBlank()) {
            return new ParsedQuestion("", null);
        }

        Optional<JsonNode> json = jsonExtractor.extractObject(sanitizedText);
        if (json.isPresent()) {
            String question = textField(json.get(), "question");
            if (question != null && !question.isBlank()) {
                String background = textField(json.get(), "background");
                if (background == null) {
                    background = textField(json.get(), "background_info");
                }
                return new ParsedQuestion(clean(question), background != null ? background.strip() : null);
            }
            log.debug("JSON model output has no question field, falling back to plain text");
        }

        return new ParsedQuestion(fromPlainText(sanitizedText), null);
    }

    private String fromPlainText(String text) {
        List<String> lines = Arrays.stream(text.split("\\R"))
                .map(this::clean)
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.size() <= 1) {
            return lines.isEmpty() ? "" : lines.get(0);
        }
        // several lines: the first one that reads as a question wins
        return lines.stream()
                .filter(line -> line.endsWith("?") || line.endsWith("？"))
                .findFirst()
                .orElseGet(() -> clean(text));
    }

    private String clean(String text) {
        String cleaned = WHITESPACE.matcher(text).replaceAll(" ").strip();
        cleaned = LEADING_NUMBERING.matcher(cleaned).replaceFirst("");
        cleaned = LEADING_LABEL.matcher(cleaned).replaceFirst("");
        if (cleaned.length() >= 2 && cleaned.startsWith("\"") && cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        return cleaned.strip();
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
