package com.interviewpilot.orchestrator.model;

/**
 * Lifecycle phase of an interview session.
 *
 * Transitions (happy path):
 *   INTERVIEWING → REVIEWING → REPORTING → DONE
 *
 * INTERVIEWING, REVIEWING or REPORTING can move to CANCELLED (caller cancel or
 * idle eviction) or FAILED (internal invariant violation).
 */
public enum SessionPhase {
    INTERVIEWING,
    REVIEWING,
    REPORTING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean terminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
