package com.interviewpilot.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured evaluation of one answer.
 *
 * Produced either by the judge or synthesised by the keyword evaluator.
 * Scores are on a 0–10 scale.
 *
 * @param perPointStatus coverage per expected point, in expected-point order
 * @param overallScore   0–10
 * @param followUp       judge-suggested follow-up question, or null
 */
public record Verdict(Map<String, PointStatus> perPointStatus,
                      double overallScore,
                      String followUp) {

    public static final double MAX_SCORE = 10.0;

    public Verdict {
        perPointStatus = perPointStatus == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(perPointStatus));
    }

    /**
     * Expected points that are not covered. A point the verdict does not
     * mention at all is treated as missing.
     */
    public List<String> missingPoints(List<String> expectedPoints) {
        return expectedPoints.stream()
                .filter(p -> {
                    PointStatus status = perPointStatus.get(p);
                    return status == null || !status.covered();
                })
                .toList();
    }

    /** Builds the verdict the keyword evaluator reports: covered points are PRESENT. */
    public static Verdict fromKeywords(List<String> required, List<String> missing) {
        Map<String, PointStatus> statuses = new LinkedHashMap<>();
        for (String keyword : required) {
            statuses.put(keyword, missing.contains(keyword) ? PointStatus.MISSING : PointStatus.PRESENT);
        }
        double score = required.isEmpty()
                ? MAX_SCORE
                : MAX_SCORE * (required.size() - missing.size()) / required.size();
        return new Verdict(statuses, score, null);
    }
}
