package com.interviewpilot.orchestrator.session;

import com.interviewpilot.orchestrator.model.SessionPhase;

/** The session reached a terminal phase (DONE, CANCELLED or FAILED); it accepts no more answers. */
public class SessionAlreadyCompletedException extends RuntimeException {

    private final String       sessionId;
    private final SessionPhase phase;

    public SessionAlreadyCompletedException(String sessionId, SessionPhase phase) {
        super("Interview session '" + sessionId + "' is already " + phase);
        this.sessionId = sessionId;
        this.phase     = phase;
    }

    public String       getSessionId() { return sessionId; }
    public SessionPhase getPhase()     { return phase; }
}
