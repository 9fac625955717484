package com.interviewpilot.orchestrator.evaluation;

import com.interviewpilot.orchestrator.model.Verdict;

import java.util.List;

/**
 * Outcome of evaluating one answer against one question.
 *
 * @param missing           uncovered points, in required-keyword order
 * @param suggestedFollowUp a single follow-up proposed by the evaluator (judge mode), or null
 * @param verdict           the full verdict, kept in the question's follow-up history
 */
public record Evaluation(List<String> missing, String suggestedFollowUp, Verdict verdict) {

    public Evaluation {
        missing = List.copyOf(missing);
    }

    public boolean hasGap() {
        return !missing.isEmpty();
    }
}
