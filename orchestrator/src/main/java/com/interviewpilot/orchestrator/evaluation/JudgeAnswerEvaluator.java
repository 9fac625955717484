package com.interviewpilot.orchestrator.evaluation;

import com.interviewpilot.orchestrator.judge.Judge;
import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.Question;
import com.interviewpilot.orchestrator.model.Verdict;

import java.util.List;

/**
 * Semantic evaluator backed by the {@link Judge}.
 *
 * The question's required keywords are sent as the expected points. A point
 * the judge leaves out of its verdict counts as missing. Judge failures are
 * propagated; the turn state machine turns them into an "unevaluated" record.
 */
public class JudgeAnswerEvaluator implements AnswerEvaluator {

    private final Judge judge;

    public JudgeAnswerEvaluator(Judge judge) {
        this.judge = judge;
    }

    @Override
    public Evaluation evaluate(Question question, String answer) throws JudgeException {
        Verdict verdict = judge.evaluate(question.text(), answer, question.requiredKeywords());
        List<String> missing = verdict.missingPoints(question.requiredKeywords());
        String followUp = verdict.followUp() == null || verdict.followUp().isBlank()
                ? null
                : verdict.followUp().strip();
        return new Evaluation(missing, followUp, verdict);
    }

    @Override
    public EvaluationMode mode() {
        return EvaluationMode.JUDGE;
    }
}
