package com.interviewpilot.orchestrator.model;

/**
 * Position of the turn state machine inside one prompt/answer cycle.
 *
 * Transitions:
 *   AWAITING_PROMPT → AWAITING_ANSWER   (prompt emitted)
 *   AWAITING_PROMPT → REVIEWING         (no questions left)
 *   AWAITING_ANSWER → EVALUATING        (answer delivered)
 *   EVALUATING      → AWAITING_PROMPT   (follow-up queued or index advanced)
 */
public enum TurnState {
    AWAITING_PROMPT,
    AWAITING_ANSWER,
    EVALUATING,
    REVIEWING
}
