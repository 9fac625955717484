package com.interviewpilot.orchestrator.model;

import java.util.List;

/**
 * Append-only log entry for a fully resolved question.
 *
 * Exactly one is written per question: when the answer covers every point,
 * when the follow-up budget is exhausted, or when evaluation was unavailable.
 * The answer text is the final (resolving) answer, not the first one.
 *
 * @param missing        points still uncovered when the question was resolved
 * @param notes          interviewer guidance, plus an "evaluation unavailable" note if the judge failed
 * @param followUpsAsked follow-up rounds spent on this question
 * @param score          score of the final verdict, null when unevaluated
 */
public record AnsweredRecord(
        String       questionId,
        String       questionText,
        String       answerText,
        List<String> missing,
        String       notes,
        int          followUpsAsked,
        Double       score) {

    public AnsweredRecord {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public boolean complete() {
        return missing.isEmpty() && score != null;
    }
}
