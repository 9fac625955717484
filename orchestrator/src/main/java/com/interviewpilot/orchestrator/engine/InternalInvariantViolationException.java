package com.interviewpilot.orchestrator.engine;

/**
 * The turn state machine found the session in a state it can never legally
 * reach (e.g. follow-ups queued after the last question was resolved).
 *
 * Fatal to the affected session only: the owning session moves to FAILED and
 * logs its full snapshot. Other sessions are unaffected.
 */
public class InternalInvariantViolationException extends RuntimeException {

    public InternalInvariantViolationException(String message) {
        super(message);
    }
}
