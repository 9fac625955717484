package com.interviewpilot.orchestrator.engine;

/** What an evaluated answer did to the session's progress. */
public enum TurnOutcome {
    /** Every required point covered; the question is recorded and the index advances. */
    RESOLVED,
    /** Gap found with budget left; follow-ups queued, index unchanged. */
    FOLLOW_UP,
    /** Gap found with the budget spent; recorded with its gaps, index advances. */
    EXHAUSTED,
    /** The evaluator failed; recorded as unevaluated, index advances. */
    UNEVALUATED
}
