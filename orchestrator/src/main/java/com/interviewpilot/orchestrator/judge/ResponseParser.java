package com.interviewpilot.orchestrator.judge;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON verdict out of a judge's text response.
 *
 * Models are asked for bare JSON but regularly wrap it in a fenced block or
 * add a sentence around it, so both shapes are accepted:
 * <pre>
 *   ```json
 *   {"points": {...}, "score": 7, "follow_up": null}
 *   ```
 *   Here is my verdict: {"points": {...}, ...}
 * </pre>
 */
public class ResponseParser {

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern FENCED_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** Content of the first fenced block, if any. */
    public static Optional<String> extractFencedBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = FENCED_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * The JSON object in the response: the fenced block if present, otherwise
     * the span from the first '{' to the last '}'.
     */
    public static Optional<String> extractJsonObject(String response) {
        if (response == null || response.isBlank()) return Optional.empty();
        String candidate = extractFencedBlock(response).orElse(response);
        int start = candidate.indexOf('{');
        int end   = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) return Optional.empty();
        return Optional.of(candidate.substring(start, end + 1));
    }
}
