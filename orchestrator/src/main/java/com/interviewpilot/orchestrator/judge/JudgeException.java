package com.interviewpilot.orchestrator.judge;

/**
 * Thrown when a judge call cannot produce a usable result.
 *
 * Every kind is recoverable at the turn level: the turn state machine records
 * the question as unevaluated and the review stage records the error, so a
 * judge failure never ends a session.
 */
public class JudgeException extends RuntimeException {

    public enum Kind { UNAVAILABLE, TIMEOUT, MALFORMED_RESPONSE }

    private final Kind kind;

    public JudgeException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public JudgeException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
