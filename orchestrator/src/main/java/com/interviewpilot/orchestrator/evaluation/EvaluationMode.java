package com.interviewpilot.orchestrator.evaluation;

import java.util.Locale;

/** Which {@link AnswerEvaluator} implementation the engine uses. */
public enum EvaluationMode {
    KEYWORD,
    JUDGE;

    /** Parses "keyword" / "judge" (any case) from configuration. */
    public static EvaluationMode fromProperty(String value) {
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    "interview.evaluator.mode must be 'keyword' or 'judge', was '" + value + "'", e);
        }
    }
}
