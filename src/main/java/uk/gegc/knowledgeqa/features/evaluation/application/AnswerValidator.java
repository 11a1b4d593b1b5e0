package uk.gegc.knowledgeqa.features.evaluation.application;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects answers that are not worth sending to the model.
 */
@Component
public class AnswerValidator {

    static final int MIN_LENGTH = 2;
    static final int MAX_LENGTH = 2000;

    private static final Set<String> NON_ANSWERS = Set.of(
            "不知道", "不清楚", "不会", "不懂", "没有", "无",
            "i don't know", "i dont know", "idk", "no idea", "don't know", "dont know", "n/a");
    private static final Pattern ONLY_PUNCTUATION = Pattern.compile("^[\\p{P}\\p{S}\\s]+$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{P}\\s]+$");

    /**
     * @return human-readable issues; empty when the answer can be evaluated
     */
    public List<String> validate(String answer) {
        List<String> issues = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            issues.add("answer is empty");
            return issues;
        }

        String trimmed = answer.strip();
        if (trimmed.length() < MIN_LENGTH) {
            issues.add("answer is shorter than " + MIN_LENGTH + " characters");
        }
        if (trimmed.length() > MAX_LENGTH) {
            issues.add("answer is longer than " + MAX_LENGTH + " characters");
        }
        if (ONLY_PUNCTUATION.matcher(trimmed).matches()) {
            issues.add("answer contains only punctuation");
        } else {
            String normalized = TRAILING_PUNCTUATION.matcher(trimmed.toLowerCase(Locale.ROOT)).replaceAll("");
            if (NON_ANSWERS.contains(normalized)) {
                issues.add("answer does not attempt the question");
            }
        }
        return issues;
    }
}
