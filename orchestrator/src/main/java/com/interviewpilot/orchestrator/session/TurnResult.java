package com.interviewpilot.orchestrator.session;

import com.interviewpilot.orchestrator.model.SessionPhase;

/**
 * What the UI gets back after creating a session or submitting an answer.
 * Always exactly one of: a prompt, a completion, a cancellation, a failure.
 *
 * @param prompt  next prompt to show; null unless the session is waiting for an answer
 * @param done    true once the session reached a terminal phase
 * @param message human-readable status (completion note, cancel or failure reason)
 */
public record TurnResult(
        String       sessionId,
        String       prompt,
        boolean      done,
        boolean      cancelled,
        SessionPhase phase,
        String       message) {

    public static TurnResult prompt(String sessionId, String prompt) {
        return new TurnResult(sessionId, prompt, false, false, SessionPhase.INTERVIEWING, null);
    }

    public static TurnResult completed(String sessionId) {
        return new TurnResult(sessionId, null, true, false, SessionPhase.DONE, "Interview complete.");
    }

    public static TurnResult cancelled(String sessionId, String reason) {
        return new TurnResult(sessionId, null, true, true, SessionPhase.CANCELLED, reason);
    }

    public static TurnResult failed(String sessionId, String reason) {
        return new TurnResult(sessionId, null, true, false, SessionPhase.FAILED, reason);
    }

    /** The first prompt was not produced within the startup timeout; the session keeps starting. */
    public static TurnResult starting(String sessionId) {
        return new TurnResult(sessionId, null, false, false, SessionPhase.INTERVIEWING,
                "Session is starting; the first prompt is not ready yet.");
    }
}
