package uk.gegc.knowledgeqa.features.question.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quality gate for generated questions. {@link #validate} returns the first rejection reason,
 * or empty when the question is acceptable.
 */
@Component
@RequiredArgsConstructor
public class QuestionValidator {

    static final int MIN_LENGTH = 5;
    static final int MAX_LENGTH = 500;
    static final int LONG_QUESTION_LENGTH = 200;
    static final double MAX_QUALITY_SCORE = 10.0;

    private static final List<String> CHINESE_QUALITY_KEYWORDS = List.of(
            "什么", "如何", "为什么", "怎样", "哪些", "谁", "何时", "何地",
            "解释", "描述", "分析", "比较", "评价", "讨论");
    private static final List<Pattern> ENGLISH_QUALITY_KEYWORDS = List.of(
                    "what", "how", "why", "which", "who", "when", "where",
                    "explain", "describe", "analyze", "analyse", "compare", "evaluate", "discuss")
            .stream()
            .map(keyword -> Pattern.compile("\\b" + keyword + "\\b"))
            .toList();

    private static final Pattern ENGLISH_INTERROGATIVE = Pattern.compile(
            "^(what|why|how|when|where|who|whom|whose|which|is|are|was|were|do|does|did|can|could|"
                    + "should|would|will|has|have|had|in what|to what)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CHINESE_INTERROGATIVE =
            Pattern.compile("什么|为什么|为何|如何|怎么|怎样|哪|谁|是否|多少|几种|几个|吗|呢");
    private static final Pattern OPTION_MARKER = Pattern.compile("(?:^|[\\s:：(（])[A-Da-d][.)、]\\s*\\S");
    private static final Pattern POLITE_REQUEST_OPENING = Pattern.compile("^请问?");
    private static final Pattern CHOICE_INSTRUCTION = Pattern.compile("(以下|下面).*选择|(?i)choose from the following");

    private final RecentQuestionRegistry recentQuestions;

    public Optional<String> validate(String kbName, String question) {
        return issues(kbName, question).stream().findFirst();
    }

    /**
     * Every rule the question breaks, in the order {@link #validate} checks them.
     */
    public List<String> issues(String kbName, String question) {
        if (question == null || question.isBlank()) {
            return List.of("empty question");
        }
        String text = question.strip();
        List<String> issues = new ArrayList<>();

        if (text.length() < MIN_LENGTH) {
            issues.add("question shorter than " + MIN_LENGTH + " characters");
        }
        if (text.length() > MAX_LENGTH) {
            issues.add("question longer than " + MAX_LENGTH + " characters");
        }
        if (!looksLikeQuestion(text)) {
            issues.add("not phrased as a question");
        }
        if (countOptionMarkers(text) >= 2) {
            issues.add("contains multiple-choice options");
        }
        if (POLITE_REQUEST_OPENING.matcher(text).find()) {
            issues.add("phrased as a request instead of a question");
        }
        if (recentQuestions.isNearDuplicate(kbName, text)) {
            issues.add("near-duplicate of a recent question");
        }
        return issues;
    }

    /**
     * Validation issues plus a 0-10 quality score. The score starts at 10 and loses points for
     * an unusual length, a missing question mark, no guiding keyword and each structural problem;
     * more than two guiding keywords earn a bonus point.
     */
    public QuestionQualityReport qualityReport(String kbName, String question) {
        String text = question == null ? "" : question.strip();
        boolean hasQuestionMark = text.contains("?") || text.contains("？");

        double score = MAX_QUALITY_SCORE;
        if (text.length() < MIN_LENGTH) {
            score -= 3.0;
        } else if (text.length() > LONG_QUESTION_LENGTH) {
            score -= 2.0;
        }
        if (!hasQuestionMark) {
            score -= 4.0;
        }
        long keywordCount = countQualityKeywords(text);
        if (keywordCount == 0) {
            score -= 2.0;
        } else if (keywordCount > 2) {
            score += 1.0;
        }
        if (countOptionMarkers(text) >= 2) {
            score -= 2.5;
        }
        if (POLITE_REQUEST_OPENING.matcher(text).find()) {
            score -= 2.5;
        }
        if (CHOICE_INSTRUCTION.matcher(text).find()) {
            score -= 2.5;
        }

        List<String> issues = issues(kbName, question);
        return new QuestionQualityReport(issues.isEmpty(), issues, text.length(), hasQuestionMark,
                Math.max(0.0, Math.min(MAX_QUALITY_SCORE, score)));
    }

    private static long countQualityKeywords(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        long chinese = CHINESE_QUALITY_KEYWORDS.stream().filter(text::contains).count();
        long english = ENGLISH_QUALITY_KEYWORDS.stream()
                .filter(keyword -> keyword.matcher(lower).find())
                .count();
        return chinese + english;
    }

    static boolean looksLikeQuestion(String text) {
        if (text.contains("?") || text.contains("？")) {
            return true;
        }
        return ENGLISH_INTERROGATIVE.matcher(text.toLowerCase(Locale.ROOT)).find()
                || CHINESE_INTERROGATIVE.matcher(text).find();
    }

    private static int countOptionMarkers(String text) {
        Matcher matcher = OPTION_MARKER.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
