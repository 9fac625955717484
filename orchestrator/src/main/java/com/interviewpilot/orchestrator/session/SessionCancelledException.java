package com.interviewpilot.orchestrator.session;

/**
 * Terminal signal used to release a session that is waiting for an answer
 * when it gets cancelled or evicted. Callers see it as a cancelled
 * {@link TurnResult}, never as a thrown exception.
 */
class SessionCancelledException extends RuntimeException {

    SessionCancelledException(String sessionId, String reason) {
        super("Interview session '" + sessionId + "' cancelled: " + reason);
    }
}
