package com.interviewpilot.orchestrator.session;

/** No live session with this id (never created, or already evicted). */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No interview session with id: '" + sessionId + "'");
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
