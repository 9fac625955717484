package com.interviewpilot.orchestrator.session;

import com.interviewpilot.orchestrator.config.ConfigInvalidException;
import com.interviewpilot.orchestrator.config.EngineSettings;
import com.interviewpilot.orchestrator.engine.TurnStateMachine;
import com.interviewpilot.orchestrator.evaluation.AnswerEvaluator;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.review.ReviewStage;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry and entry point for interview sessions.
 *
 * Sessions are independent: each one has its own state and monitor, and the
 * registry lock only guards the id → session map. The lock order is always
 * registry before session, never the reverse.
 *
 * Lifecycle:
 * <pre>
 *   createSession ──▶ INTERVIEWING ──▶ REVIEWING ──▶ REPORTING ──▶ DONE
 *                          │               │             │
 *                          ├──cancel()─────┴─────────────┴──▶ CANCELLED
 *                          └──invariant broken / evaluator error──▶ FAILED
 * </pre>
 * Finished sessions stay readable until idle eviction removes them.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final AnswerEvaluator evaluator;
    private final ReviewStage     reviewStage;
    private final EngineSettings  settings;
    private final Executor        workers;
    private final Clock           clock;
    private final MeterRegistry   meterRegistry;

    private final Object registryLock = new Object();
    // guarded by registryLock
    private final Map<String, InterviewSession> sessions = new HashMap<>();

    public SessionManager(AnswerEvaluator evaluator,
                          ReviewStage reviewStage,
                          EngineSettings settings,
                          @Qualifier("sessionWorkers") Executor workers,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.evaluator     = evaluator;
        this.reviewStage   = reviewStage;
        this.settings      = settings;
        this.workers       = workers;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        Gauge.builder("interview.sessions.active", this, SessionManager::activeSessionCount)
                .description("Interview sessions that have not finished yet")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Validate the config and start a session, returning as soon as it is registered.
     *
     * @throws ConfigInvalidException        the question set is unusable
     * @throws SessionLimitExceededException too many unfinished sessions
     */
    public SessionHandle openSession(InterviewConfig config) {
        if (config == null) {
            throw new ConfigInvalidException(List.of("interview config is required"));
        }
        InterviewConfig validated = config.validate().withDefaultPolicy(settings.defaultFollowUpPolicy());

        InterviewSession session;
        synchronized (registryLock) {
            long unfinished = sessions.values().stream().filter(s -> !s.isFinished()).count();
            if (unfinished >= settings.maxActiveSessions()) {
                meterRegistry.counter("interview.sessions", "outcome", "rejected").increment();
                throw new SessionLimitExceededException(settings.maxActiveSessions());
            }
            String id = UUID.randomUUID().toString();
            TurnStateMachine machine = new TurnStateMachine(validated, evaluator, settings.defaultFollowUpPolicy());
            session = new InterviewSession(id, validated, machine, reviewStage, workers, clock, meterRegistry);
            sessions.put(id, session);
        }
        meterRegistry.counter("interview.sessions", "outcome", "created").increment();
        log.info("Session {} created: {} questions, max {} follow-up chances, policy {}",
                session.id(), validated.questionCount(), validated.maxFollowupChances(),
                validated.followUpPolicy());
        return new SessionHandle(session.id(), session.start());
    }

    /**
     * Start a session and wait (up to the startup timeout) for its first prompt.
     * If the prompt is not ready in time the session keeps starting and the
     * result says so; the caller may already submit one answer.
     */
    public TurnResult createSession(InterviewConfig config) {
        SessionHandle handle = openSession(config);
        try {
            return handle.firstTurn().get(settings.startupTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Session {} has no first prompt after {}", handle.sessionId(), settings.startupTimeout());
            return TurnResult.starting(handle.sessionId());
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TurnResult.starting(handle.sessionId());
        }
    }

    // ------------------------------------------------------------------
    // Turns
    // ------------------------------------------------------------------

    /** Submit an answer and block until the next prompt, completion or cancellation. */
    public TurnResult submitAnswer(String sessionId, String answer) {
        CompletableFuture<TurnResult> next = submitAnswerAsync(sessionId, answer);
        try {
            return next.join();
        } catch (CompletionException e) {
            throw propagate(e.getCause());
        }
    }

    /**
     * Submit an answer without waiting for its evaluation.
     *
     * @throws SessionNotFoundException         unknown or evicted id
     * @throws SessionAlreadyCompletedException session is DONE, CANCELLED or FAILED
     * @throws NoPendingQuestionException       no prompt is waiting for an answer
     */
    public CompletableFuture<TurnResult> submitAnswerAsync(String sessionId, String answer) {
        return lookup(sessionId).submitAsync(answer);
    }

    /** The turn that will follow the prompt currently shown, if any. */
    public Optional<CompletableFuture<TurnResult>> pendingTurn(String sessionId) {
        return lookup(sessionId).pendingTurn();
    }

    /** Read-only copy of the session state; never changes the session. */
    public SessionSnapshot getState(String sessionId) {
        return lookup(sessionId).snapshot();
    }

    /**
     * Cancel a session. Cancelling an already cancelled session is a no-op.
     *
     * @throws SessionAlreadyCompletedException the session is DONE or FAILED
     */
    public TurnResult cancel(String sessionId) {
        InterviewSession session = lookup(sessionId);
        boolean wasFinished = session.isFinished();
        TurnResult result = session.cancel("cancelled by caller", false);
        if (!wasFinished) {
            meterRegistry.counter("interview.sessions", "outcome", "cancelled").increment();
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Housekeeping
    // ------------------------------------------------------------------

    /**
     * Drop every session idle for longer than the idle timeout, cancelling the
     * unfinished ones.
     *
     * @return number of sessions evicted
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(settings.idleTimeout());
        List<InterviewSession> evicted = new ArrayList<>();
        synchronized (registryLock) {
            Iterator<InterviewSession> it = sessions.values().iterator();
            while (it.hasNext()) {
                InterviewSession session = it.next();
                if (session.idleSince(cutoff)) {
                    it.remove();
                    evicted.add(session);
                }
            }
        }
        for (InterviewSession session : evicted) {
            boolean wasFinished = session.isFinished();
            session.cancel("evicted after " + settings.idleTimeout() + " idle", true);
            if (!wasFinished) {
                meterRegistry.counter("interview.sessions", "outcome", "evicted").increment();
            }
            log.info("Session {} evicted (idle since before {})", session.id(), cutoff);
        }
        return evicted.size();
    }

    /** Registered sessions that have not reached a terminal phase. */
    public int activeSessionCount() {
        synchronized (registryLock) {
            return (int) sessions.values().stream().filter(s -> !s.isFinished()).count();
        }
    }

    private InterviewSession lookup(String sessionId) {
        InterviewSession session;
        synchronized (registryLock) {
            session = sessions.get(sessionId);
        }
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("interview turn failed: " + cause, cause);
    }
}
