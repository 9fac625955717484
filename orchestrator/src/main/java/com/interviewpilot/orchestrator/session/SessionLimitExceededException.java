package com.interviewpilot.orchestrator.session;

/** Creating another session would exceed {@code interview.session.max-active}. */
public class SessionLimitExceededException extends RuntimeException {

    public SessionLimitExceededException(int maxActive) {
        super("Maximum number of active interview sessions reached (" + maxActive + ")");
    }
}
