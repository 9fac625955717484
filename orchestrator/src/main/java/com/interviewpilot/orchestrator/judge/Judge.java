package com.interviewpilot.orchestrator.judge;

import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.Verdict;

import java.util.List;

/**
 * External semantic judge.
 *
 * The engine treats it as a black box with a fixed contract; prompt wording
 * and model choice live entirely inside the implementation.
 */
public interface Judge {

    /**
     * Judge one answer against the points it was expected to cover.
     *
     * @throws JudgeException UNAVAILABLE, TIMEOUT or MALFORMED_RESPONSE
     */
    Verdict evaluate(String question, String answer, List<String> expectedPoints) throws JudgeException;

    /**
     * Produce a free-text assessment of the whole interview.
     *
     * @throws JudgeException UNAVAILABLE, TIMEOUT or MALFORMED_RESPONSE
     */
    String summarize(String jobDescription, List<AnsweredRecord> answers) throws JudgeException;
}
