package com.interviewpilot.orchestrator.evaluation;

import com.interviewpilot.orchestrator.model.Question;
import com.interviewpilot.orchestrator.model.Verdict;

import java.util.List;

/**
 * Keyword-based evaluator: transparent and deterministic.
 * The verdict it reports marks every found keyword PRESENT and scores the
 * answer by the share of keywords covered.
 */
public class KeywordAnswerEvaluator implements AnswerEvaluator {

    @Override
    public Evaluation evaluate(Question question, String answer) {
        List<String> missing = KeywordMatcher.missingKeywords(answer, question.requiredKeywords());
        return new Evaluation(missing, null, Verdict.fromKeywords(question.requiredKeywords(), missing));
    }

    @Override
    public EvaluationMode mode() {
        return EvaluationMode.KEYWORD;
    }
}
