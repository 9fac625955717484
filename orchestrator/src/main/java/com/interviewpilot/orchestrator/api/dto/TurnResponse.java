package com.interviewpilot.orchestrator.api.dto;

import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.session.TurnResult;

/**
 * Response body for every call that moves a session forward.
 * Exactly one of: a prompt to show, done, or cancelled.
 */
public record TurnResponse(
        String       sessionId,
        String       prompt,
        boolean      done,
        boolean      cancelled,
        SessionPhase phase,
        String       message
) {
    public static TurnResponse from(TurnResult r) {
        return new TurnResponse(
                r.sessionId(),
                r.prompt(),
                r.done(),
                r.cancelled(),
                r.phase(),
                r.message()
        );
    }
}
