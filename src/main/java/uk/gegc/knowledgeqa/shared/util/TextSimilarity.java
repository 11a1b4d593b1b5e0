package uk.gegc.knowledgeqa.shared.util;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-neutral lexical helpers. Han text has no word boundaries, so runs of Han
 * characters are split into overlapping bigrams while other scripts are split into words.
 */
public final class TextSimilarity {

    private static final Pattern TOKEN = Pattern.compile("\\p{IsHan}+|[\\p{L}\\p{N}&&[^\\p{IsHan}]]+");
    private static final Pattern NON_CONTENT = Pattern.compile("[\\s\\p{P}\\p{S}]+");

    private TextSimilarity() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Lower-cased search terms: words for alphabetic scripts, character bigrams for Han runs.
     */
    public static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) {
            return terms;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (Character.UnicodeScript.of(token.codePointAt(0)) == Character.UnicodeScript.HAN) {
                if (token.length() == 1) {
                    terms.add(token);
                }
                for (int i = 0; i + 1 < token.length(); i++) {
                    terms.add(token.substring(i, i + 2));
                }
            } else {
                terms.add(token);
            }
        }
        return terms;
    }

    /**
     * Character-bigram Jaccard similarity in [0, 1], ignoring case, whitespace and punctuation.
     */
    public static double bigramSimilarity(String left, String right) {
        Set<String> a = characterBigrams(left);
        Set<String> b = characterBigrams(right);
        if (a.isEmpty() && b.isEmpty()) {
            return normalize(left).equals(normalize(right)) ? 1.0 : 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    static Set<String> characterBigrams(String text) {
        String normalized = normalize(text);
        Set<String> bigrams = new HashSet<>();
        for (int i = 0; i + 1 < normalized.length(); i++) {
            bigrams.add(normalized.substring(i, i + 2));
        }
        return bigrams;
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_CONTENT.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }
}
