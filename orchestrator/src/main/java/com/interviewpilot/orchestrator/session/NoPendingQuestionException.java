package com.interviewpilot.orchestrator.session;

/**
 * An answer arrived while the session was not waiting for one (e.g. the
 * previous answer is still being evaluated). Answers are never buffered,
 * except for a single early answer before the first prompt exists.
 */
public class NoPendingQuestionException extends RuntimeException {

    private final String sessionId;

    public NoPendingQuestionException(String sessionId) {
        super("Interview session '" + sessionId + "' is not waiting for an answer");
        this.sessionId = sessionId;
    }

    public String getSessionId() { return sessionId; }
}
