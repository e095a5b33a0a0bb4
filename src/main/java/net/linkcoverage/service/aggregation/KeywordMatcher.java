package net.linkcoverage.service.aggregation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-insensitive, whole-word keyword matching.
 *
 * <p>A keyword matches only when it is not glued to other letters or digits, so {@code acme}
 * matches "Acme launches" and "(ACME)" but not "acmeville". Multi-word keywords match as phrases
 * with any run of whitespace between words.</p>
 */
public final class KeywordMatcher {

    private final List<Pattern> patterns;
    private final List<String> keywords;

    private KeywordMatcher(List<String> keywords, List<Pattern> patterns) {
        this.keywords = keywords;
        this.patterns = patterns;
    }

    public static KeywordMatcher of(List<String> keywords) {
        Set<String> distinct = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    distinct.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        List<String> normalized = List.copyOf(distinct);
        List<Pattern> patterns = new ArrayList<>(normalized.size());
        for (String keyword : normalized) {
            patterns.add(compile(keyword));
        }
        return new KeywordMatcher(normalized, List.copyOf(patterns));
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Counts matches of every keyword in {@code text}.
     */
    public KeywordMatch match(String text) {
        if (text == null || text.isBlank() || patterns.isEmpty()) {
            return KeywordMatch.NONE;
        }
        List<String> matched = new ArrayList<>();
        int occurrences = 0;
        for (int i = 0; i < patterns.size(); i++) {
            Matcher matcher = patterns.get(i).matcher(text);
            int count = 0;
            while (matcher.find()) {
                count++;
            }
            if (count > 0) {
                matched.add(keywords.get(i));
                occurrences += count;
            }
        }
        return matched.isEmpty() ? KeywordMatch.NONE : new KeywordMatch(List.copyOf(matched), occurrences);
    }

    private static Pattern compile(String keyword) {
        String[] words = keyword.split("\\s+");
        StringBuilder regex = new StringBuilder("(?<![\\p{L}\\p{N}])");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append("(?![\\p{L}\\p{N}])");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * @param matchedKeywords distinct keywords found, in configuration order
     * @param occurrences total hits across all keywords
     */
    public record KeywordMatch(List<String> matchedKeywords, int occurrences) {

        public static final KeywordMatch NONE = new KeywordMatch(List.of(), 0);

        public boolean matched() {
            return !matchedKeywords.isEmpty();
        }
    }
}
