package com.interviewpilot.orchestrator.config;

import com.interviewpilot.orchestrator.engine.FollowUpPolicy;
import com.interviewpilot.orchestrator.evaluation.EvaluationMode;

import java.time.Duration;

/**
 * Engine-wide tuning knobs, resolved once at startup (see {@link EngineConfig}).
 *
 * @param maxActiveSessions     creation is refused beyond this many live sessions
 * @param idleTimeout           sessions without activity for longer are evicted
 * @param startupTimeout        how long createSession waits for the first prompt
 * @param judgeTimeout          wall-clock bound on every judge call
 * @param evaluationMode        keyword or judge-based gap detection
 * @param defaultFollowUpPolicy used when a session's config does not pick one
 */
public record EngineSettings(
        int            maxActiveSessions,
        Duration       idleTimeout,
        Duration       startupTimeout,
        Duration       judgeTimeout,
        EvaluationMode evaluationMode,
        FollowUpPolicy defaultFollowUpPolicy) {

    public EngineSettings {
        if (maxActiveSessions <= 0) {
            throw new IllegalArgumentException("interview.session.max-active must be > 0");
        }
    }

    /** Defaults matching application.yml; handy for tests and embedding. */
    public static EngineSettings defaults() {
        return new EngineSettings(100, Duration.ofMinutes(30), Duration.ofSeconds(10),
                Duration.ofSeconds(30), EvaluationMode.KEYWORD, FollowUpPolicy.PER_QUESTION);
    }
}
