package uk.gegc.knowledgeqa.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes "thinking" segments that reasoning models interleave with their final answer.
 *
 * Recognised delimiters are {@code <think>}, {@code <thinking>}, {@code <thought>} and
 * {@code <reasoning>} in any case. Closed blocks are removed wherever they appear. An
 * unclosed block is removed through the end of the text and flagged as truncated. A closing
 * tag with no opening tag (some models omit the opening one) removes everything before it.
 * If nothing would remain, the raw text is returned unchanged so that downstream parsing can
 * still try to use it. Sanitizing already-sanitized text returns it unchanged.
 */
@Component
@Slf4j
public class ResponseSanitizer {

    private static final String TAGS = "think|thinking|thought|reasoning";

    private static final Pattern CLOSED_BLOCK =
            Pattern.compile("<(" + TAGS + ")\\s*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern UNTERMINATED_BLOCK =
            Pattern.compile("<(?:" + TAGS + ")\\s*>.*\\z", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ORPHAN_CLOSING_TAG =
            Pattern.compile("\\A.*?</(?:" + TAGS + ")\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n");

    public String sanitize(String rawText) {
        return sanitizeDetailed(rawText).text();
    }

    public SanitizedResponse sanitizeDetailed(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return new SanitizedResponse("", false, false);
        }

        String text = CLOSED_BLOCK.matcher(rawText).replaceAll("");
        text = ORPHAN_CLOSING_TAG.matcher(text).replaceFirst("");

        boolean truncated = false;
        Matcher unterminated = UNTERMINATED_BLOCK.matcher(text);
        if (unterminated.find()) {
            truncated = true;
            text = text.substring(0, unterminated.start());
            log.warn("Model output contains an unterminated reasoning block; removed {} trailing characters",
                    rawText.length() - text.length());
        }

        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n").strip();

        if (text.isEmpty()) {
            log.warn("Model output consists only of reasoning; returning raw text unchanged");
            return new SanitizedResponse(rawText, truncated, true);
        }
        return new SanitizedResponse(text, truncated, false);
    }
}
