package com.interviewpilot.orchestrator.evaluation;

import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.Question;

/**
 * Gap-detection capability used by the turn state machine.
 *
 * Two interchangeable implementations exist, selected by
 * {@code interview.evaluator.mode}:
 * <ul>
 *   <li>{@link KeywordAnswerEvaluator} — deterministic keyword search, never fails.</li>
 *   <li>{@link JudgeAnswerEvaluator} — delegates to the judge; may throw {@link JudgeException}.</li>
 * </ul>
 */
public interface AnswerEvaluator {

    /**
     * Evaluate {@code answer} against the full required-point set of {@code question}.
     *
     * @throws JudgeException when a judge-backed evaluation is unavailable, times out
     *                        or returns a malformed verdict
     */
    Evaluation evaluate(Question question, String answer) throws JudgeException;

    EvaluationMode mode();
}
