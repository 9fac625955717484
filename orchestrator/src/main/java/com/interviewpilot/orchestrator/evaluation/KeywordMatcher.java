package com.interviewpilot.orchestrator.evaluation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic keyword gap checker.
 *
 * A required keyword matches when all of its tokens appear consecutively in
 * the answer as whole tokens, case-insensitively, with any run of whitespace,
 * hyphens, underscores or slashes between them:
 * <pre>
 *   "redis cache"  matches  "Redis-cache", "redis_cache", "REDIS / cache"
 *   "cat"          does not match "categorized"
 * </pre>
 *
 * Pure utility (static methods, no state, no I/O). Never throws.
 */
public final class KeywordMatcher {

    // Separators treated as equivalent inside a multi-word keyword.
    private static final String SEPARATOR_CLASS = "[\\s\\-_/\\\\]";
    private static final Pattern KEYWORD_SPLIT  = Pattern.compile(SEPARATOR_CLASS + "+");

    // Token boundary: the neighbouring character must not be a letter or digit.
    private static final String TOKEN_START = "(?<![\\p{L}\\p{N}])";
    private static final String TOKEN_END   = "(?![\\p{L}\\p{N}])";

    private KeywordMatcher() {}

    /**
     * Return the required keywords that the answer does not mention, in input order.
     *
     * A null answer is treated as empty; a null or blank keyword is treated as satisfied.
     */
    public static List<String> missingKeywords(String answer, List<String> required) {
        if (required == null || required.isEmpty()) {
            return List.of();
        }
        String text = answer == null ? "" : answer;
        List<String> missing = new ArrayList<>();
        for (String keyword : required) {
            if (!matches(text, keyword)) {
                missing.add(keyword);
            }
        }
        return missing;
    }

    /** True if {@code keyword} occurs in {@code text} as a whole-token phrase. */
    public static boolean matches(String text, String keyword) {
        Pattern pattern = patternFor(keyword);
        return pattern == null || pattern.matcher(text == null ? "" : text).find();
    }

    static Pattern patternFor(String keyword) {
        if (keyword == null) return null;
        List<String> tokens = Arrays.stream(KEYWORD_SPLIT.split(keyword.strip()))
                .filter(t -> !t.isEmpty())
                .toList();
        if (tokens.isEmpty()) return null;
        String body = tokens.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining(SEPARATOR_CLASS + "+"));
        return Pattern.compile(TOKEN_START + body + TOKEN_END,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
