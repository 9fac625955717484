package com.interviewpilot.orchestrator.model;

import com.interviewpilot.orchestrator.review.InterviewReport;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, point-in-time copy of a {@link SessionState}.
 * Returned by {@code SessionManager.getState}; taking one never mutates the session.
 */
public record SessionSnapshot(
        String                               sessionId,
        int                                  questionIndex,
        List<String>                         pendingFollowUps,
        String                               currentPrompt,
        List<AnsweredRecord>                 answers,
        Map<Integer, FollowUpState.Summary>  followUpTracking,
        SessionPhase                         phase,
        TurnState                            turnState,
        boolean                              awaitingAnswer,
        InterviewReport                      report,
        String                               failureReason) {

    public SessionSnapshot {
        pendingFollowUps = List.copyOf(pendingFollowUps);
        answers          = List.copyOf(answers);
        followUpTracking = Collections.unmodifiableMap(new TreeMap<>(followUpTracking));
    }
}
