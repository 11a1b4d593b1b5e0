package uk.gegc.knowledgeqa.features.evaluation.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.ai.infra.parser.JsonResponseExtractor;
import uk.gegc.knowledgeqa.shared.exception.EvaluationParseException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the tagged grading format requested by the evaluation prompt:
 * {@code [VERDICT]}, {@code [SCORE]}, {@code [FEEDBACK]}, {@code [MISSING_POINTS]},
 * {@code [STRENGTHS]} and {@code [REFERENCE_ANSWER]}.
 *
 * <p>Headers may also appear as {@code NAME:} labels or markdown headings, in English or
 * Chinese, with bold markers around them. Optional sections default to empty values. When no
 * tagged verdict and score can be found the JSON shape {@code {"is_correct", "score", ...}} is
 * tried before giving up.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvaluationResponseParser {

    enum Section {
        VERDICT, SCORE, FEEDBACK, MISSING_POINTS, STRENGTHS, REFERENCE_ANSWER
    }

    private static final Map<String, Section> SECTION_ALIASES = Map.ofEntries(
            Map.entry("verdict", Section.VERDICT),
            Map.entry("correctness", Section.VERDICT),
            Map.entry("is_correct", Section.VERDICT),
            Map.entry("判断", Section.VERDICT),
            Map.entry("结论", Section.VERDICT),
            Map.entry("是否正确", Section.VERDICT),
            Map.entry("score", Section.SCORE),
            Map.entry("rating", Section.SCORE),
            Map.entry("分数", Section.SCORE),
            Map.entry("评分", Section.SCORE),
            Map.entry("得分", Section.SCORE),
            Map.entry("feedback", Section.FEEDBACK),
            Map.entry("comments", Section.FEEDBACK),
            Map.entry("反馈", Section.FEEDBACK),
            Map.entry("评价", Section.FEEDBACK),
            Map.entry("missing_points", Section.MISSING_POINTS),
            Map.entry("missing", Section.MISSING_POINTS),
            Map.entry("遗漏要点", Section.MISSING_POINTS),
            Map.entry("缺失要点", Section.MISSING_POINTS),
            Map.entry("遗漏点", Section.MISSING_POINTS),
            Map.entry("strengths", Section.STRENGTHS),
            Map.entry("优点", Section.STRENGTHS),
            Map.entry("亮点", Section.STRENGTHS),
            Map.entry("reference_answer", Section.REFERENCE_ANSWER),
            Map.entry("model_answer", Section.REFERENCE_ANSWER),
            Map.entry("参考答案", Section.REFERENCE_ANSWER),
            Map.entry("标准答案", Section.REFERENCE_ANSWER)
    );

    private static final String NAME = "([\\p{L}_ ]{1,30}?)";
    private static final Pattern BRACKETED_HEADER = Pattern.compile(
            "^\\s*(?:#{1,6}\\s*)?(?:\\*\\*)?\\s*[\\[【]\\s*" + NAME + "\\s*[\\]】]\\s*(?:\\*\\*)?\\s*[:：]?\\s*(.*)$");
    private static final Pattern LABELED_HEADER = Pattern.compile(
            "^\\s*(?:#{1,6}\\s*)?(?:\\*\\*)?\\s*" + NAME + "\\s*(?:\\*\\*)?\\s*[:：]\\s*(?:\\*\\*)?\\s*(.*)$");
    private static final Pattern HEADING_HEADER = Pattern.compile(
            "^\\s*#{1,6}\\s*(?:\\*\\*)?\\s*" + NAME + "\\s*(?:\\*\\*)?\\s*$");

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•·+]|\\d+\\s*[.)、])\\s*");
    private static final Pattern RATIO = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)");
    private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern WORD = Pattern.compile("\\p{L}+");
    private static final Pattern NO_CONTENT = Pattern.compile("(?i)^(?:none|n/a|nothing|无|没有|暂无)[.。]?$");

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
            Map.entry("zero", 0), Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3),
            Map.entry("four", 4), Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7),
            Map.entry("eight", 8), Map.entry("nine", 9), Map.entry("ten", 10),
            Map.entry("零", 0), Map.entry("一", 1), Map.entry("二", 2), Map.entry("两", 2),
            Map.entry("三", 3), Map.entry("四", 4), Map.entry("五", 5), Map.entry("六", 6),
            Map.entry("七", 7), Map.entry("八", 8), Map.entry("九", 9), Map.entry("十", 10)
    );

    private final JsonResponseExtractor jsonExtractor;

    /**
     * @throws EvaluationParseException if the verdict or the score cannot be found
     */
    public ParsedEvaluation parse(String sanitizedText) {
        if (sanitizedText == null || sanitizedText.isBlank()) {
            throw new EvaluationParseException("Evaluation response is empty");
        }

        Map<Section, String> sections = splitSections(sanitizedText);
        Optional<Boolean> verdict = Optional.ofNullable(sections.get(Section.VERDICT)).flatMap(EvaluationResponseParser::parseVerdict);
        Optional<Double> score = Optional.ofNullable(sections.get(Section.SCORE)).flatMap(EvaluationResponseParser::parseScore);

        if (verdict.isPresent() && score.isPresent()) {
            return new ParsedEvaluation(
                    verdict.get(),
                    score.get(),
                    paragraph(sections.get(Section.FEEDBACK)),
                    bullets(sections.get(Section.MISSING_POINTS)),
                    bullets(sections.get(Section.STRENGTHS)),
                    paragraph(sections.get(Section.REFERENCE_ANSWER)));
        }

        Optional<ParsedEvaluation> fromJson = parseJson(sanitizedText);
        if (fromJson.isPresent()) {
            return fromJson.get();
        }

        List<String> missing = new ArrayList<>();
        if (verdict.isEmpty()) {
            missing.add("verdict");
        }
        if (score.isEmpty()) {
            missing.add("score");
        }
        throw new EvaluationParseException("Evaluation response is missing required fields: " + String.join(", ", missing));
    }

    Map<Section, String> splitSections(String text) {
        Map<Section, StringBuilder> builders = new EnumMap<>(Section.class);
        StringBuilder current = null;

        for (String line : text.split("\\R")) {
            Optional<Map.Entry<Section, String>> header = matchHeader(line);
            if (header.isPresent()) {
                Section section = header.get().getKey();
                // a repeated header continues the first occurrence
                current = builders.computeIfAbsent(section, key -> new StringBuilder());
                appendLine(current, header.get().getValue());
            } else if (current != null) {
                appendLine(current, line);
            }
        }

        Map<Section, String> sections = new EnumMap<>(Section.class);
        builders.forEach((section, builder) -> sections.put(section, builder.toString().strip()));
        return sections;
    }

    private static Optional<Map.Entry<Section, String>> matchHeader(String line) {
        for (Pattern pattern : List.of(BRACKETED_HEADER, LABELED_HEADER, HEADING_HEADER)) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.matches()) {
                Section section = SECTION_ALIASES.get(normalizeName(matcher.group(1)));
                if (section != null) {
                    String rest = matcher.groupCount() > 1 && matcher.group(2) != null ? matcher.group(2) : "";
                    return Optional.of(Map.entry(section, rest));
                }
            }
        }
        return Optional.empty();
    }

    private static String normalizeName(String name) {
        return name.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "_");
    }

    private static void appendLine(StringBuilder builder, String line) {
        if (line == null || line.isBlank()) {
            if (!builder.isEmpty()) {
                builder.append('\n');
            }
            return;
        }
        builder.append(line.strip().replace("**", "")).append('\n');
    }

    static Optional<Boolean> parseVerdict(String text) {
        String value = text.strip().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.contains("incorrect") || value.contains("not correct") || value.contains("wrong")
                || value.startsWith("false") || value.startsWith("no")
                || value.contains("不正确") || value.contains("错误") || value.startsWith("错")) {
            return Optional.of(false);
        }
        if (value.contains("correct") || value.startsWith("true") || value.startsWith("yes")
                || value.startsWith("right") || value.contains("正确") || value.startsWith("对")) {
            return Optional.of(true);
        }
        return Optional.empty();
    }

    static Optional<Double> parseScore(String text) {
        String value = text.strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        Matcher ratio = RATIO.matcher(value);
        if (ratio.find()) {
            double numerator = Double.parseDouble(ratio.group(1));
            double denominator = Double.parseDouble(ratio.group(2));
            if (Double.isFinite(numerator) && Double.isFinite(denominator) && denominator > 0) {
                return finiteScore(numerator / denominator * 10.0);
            }
            return Optional.empty();
        }
        Matcher percent = PERCENT.matcher(value);
        if (percent.find()) {
            return finiteScore(Double.parseDouble(percent.group(1)) / 10.0);
        }
        Matcher number = NUMBER.matcher(value);
        if (number.find()) {
            return finiteScore(Double.parseDouble(number.group()));
        }

        Matcher word = WORD.matcher(value.toLowerCase(Locale.ROOT));
        if (word.find()) {
            String token = word.group();
            Integer direct = NUMBER_WORDS.get(token);
            if (direct != null) {
                return Optional.of(clamp(direct));
            }
            // Han runs such as "七分" carry the numeral in their first character
            Integer leading = NUMBER_WORDS.get(token.substring(0, 1));
            if (leading != null && Character.UnicodeScript.of(token.codePointAt(0)) == Character.UnicodeScript.HAN) {
                return Optional.of(clamp(leading));
            }
        }
        return Optional.empty();
    }

    private static Optional<Double> finiteScore(double score) {
        return Double.isFinite(score) ? Optional.of(clamp(score)) : Optional.empty();
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(10.0, score));
    }

    private static String paragraph(String text) {
        return text == null ? "" : text.strip();
    }

    private static List<String> bullets(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String item = BULLET.matcher(line).replaceFirst("").strip();
            if (!item.isEmpty() && !NO_CONTENT.matcher(item).matches()) {
                items.add(item);
            }
        }
        return items;
    }

    private Optional<ParsedEvaluation> parseJson(String text) {
        Optional<JsonNode> node = jsonExtractor.extractObject(text);
        if (node.isEmpty()) {
            return Optional.empty();
        }
        JsonNode json = node.get();
        Optional<Boolean> verdict = Optional.empty();
        JsonNode correctNode = json.get("is_correct");
        if (correctNode != null && correctNode.isBoolean()) {
            verdict = Optional.of(correctNode.asBoolean());
        } else if (correctNode != null && correctNode.isTextual()) {
            verdict = parseVerdict(correctNode.asText());
        }

        Optional<Double> score = Optional.empty();
        JsonNode scoreNode = json.get("score");
        if (scoreNode != null && scoreNode.isNumber()) {
            score = finiteScore(scoreNode.asDouble());
        } else if (scoreNode != null && scoreNode.isTextual()) {
            score = parseScore(scoreNode.asText());
        }

        if (verdict.isEmpty() || score.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Evaluation response parsed from JSON fallback");
        return Optional.of(new ParsedEvaluation(
                verdict.get(),
                score.get(),
                json.path("feedback").asText(""),
                stringList(json.get("missing_points")),
                stringList(json.get("strengths")),
                json.path("reference_answer").asText("")));
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            String value = item.asText("").strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        });
        return values;
    }
}
