package com.interviewpilot.orchestrator.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background tick that evicts idle sessions.
 *
 * fixedDelay: the next sweep starts one interval after the previous one
 * finished, so sweeps never overlap.
 */
@Component
@EnableScheduling
public class SessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionSweeper.class);

    private final SessionManager sessionManager;

    public SessionSweeper(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(fixedDelayString = "${interview.session.sweep-interval-ms:60000}")
    public void sweep() {
        int evicted = sessionManager.evictIdleSessions();
        if (evicted > 0) {
            log.info("Evicted {} idle session(s), {} still active", evicted, sessionManager.activeSessionCount());
        }
    }
}
