package com.interviewpilot.orchestrator.session;

import com.interviewpilot.orchestrator.engine.InternalInvariantViolationException;
import com.interviewpilot.orchestrator.engine.PendingAnswer;
import com.interviewpilot.orchestrator.engine.TurnOutcome;
import com.interviewpilot.orchestrator.engine.TurnStateMachine;
import com.interviewpilot.orchestrator.evaluation.Evaluation;
import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.model.SessionState;
import com.interviewpilot.orchestrator.review.InterviewReport;
import com.interviewpilot.orchestrator.review.ReviewStage;
import com.interviewpilot.orchestrator.review.ReviewSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * One running interview: owns the {@link SessionState} and drives the
 * {@link TurnStateMachine} until the interview is reviewed, cancelled or failed.
 *
 * Suspension is a future, not a parked thread. When a prompt is emitted the
 * session arms an answer waiter; the next turn is chained onto it and runs on
 * a worker once an answer arrives:
 * <pre>
 *   advance() ──prompt──▶ answerWaiter ──submitAsync()──▶ resume() ──▶ advance() ...
 *                              │
 *                              └──cancel()──▶ completed exceptionally ──▶ cancelled TurnResult
 * </pre>
 *
 * Every state access happens under this object's monitor. Evaluation and
 * review calls do not: they can wait on the judge for a long time, and a
 * snapshot or a cancel must not wait with them. Their results are applied
 * only if the session has not ended in the meantime. Callers never see the
 * raw state, only {@link SessionSnapshot} copies.
 */
class InterviewSession {

    private static final Logger log = LoggerFactory.getLogger(InterviewSession.class);

    private final String           id;
    private final InterviewConfig  config;
    private final TurnStateMachine machine;
    private final ReviewStage      reviewStage;
    private final Executor         worker;
    private final Clock            clock;
    private final MeterRegistry    meterRegistry;
    private final SessionState     state = new SessionState();

    // guarded by this
    private CompletableFuture<String>     answerWaiter;
    private CompletableFuture<TurnResult> pendingTurn;
    private boolean                       firstPromptIssued;
    private String                        earlyAnswer;
    private CompletableFuture<TurnResult> earlyTurn;
    private boolean                       evicted;

    private volatile Instant lastActivity;
    private volatile boolean finished;

    InterviewSession(String id, InterviewConfig config, TurnStateMachine machine, ReviewStage reviewStage,
                     Executor worker, Clock clock, MeterRegistry meterRegistry) {
        this.id            = id;
        this.config        = config;
        this.machine       = machine;
        this.reviewStage   = reviewStage;
        this.worker        = worker;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.lastActivity  = clock.instant();
    }

    String id() {
        return id;
    }

    /** Schedule the first turn. The returned future completes with the first prompt. */
    CompletableFuture<TurnResult> start() {
        return CompletableFuture.supplyAsync(() -> withMdc(this::advance), worker);
    }

    // ------------------------------------------------------------------
    // Caller-facing operations
    // ------------------------------------------------------------------

    /**
     * Hand an answer to the waiting turn.
     *
     * @return completes with the next prompt, the completion, or the cancellation
     * @throws SessionNotFoundException         the session was evicted
     * @throws SessionAlreadyCompletedException the session is DONE, CANCELLED or FAILED
     * @throws NoPendingQuestionException       no prompt is waiting for an answer
     */
    synchronized CompletableFuture<TurnResult> submitAsync(String answer) {
        if (evicted) {
            throw new SessionNotFoundException(id);
        }
        if (state.getPhase().terminal()) {
            throw new SessionAlreadyCompletedException(id, state.getPhase());
        }
        String text = answer == null ? "" : answer;
        lastActivity = clock.instant();

        if (answerWaiter != null) {
            CompletableFuture<String> waiter = answerWaiter;
            CompletableFuture<TurnResult> next = pendingTurn;
            answerWaiter = null;
            waiter.complete(text);
            return next;
        }
        if (!firstPromptIssued && earlyAnswer == null) {
            // Accepted once: the UI may post before the first prompt has been produced.
            log.debug("Session {} buffered an answer before its first prompt", id);
            earlyAnswer = text;
            earlyTurn   = new CompletableFuture<>();
            return earlyTurn;
        }
        throw new NoPendingQuestionException(id);
    }

    /**
     * Cancel the interview, releasing any waiting turn.
     *
     * @param evict true when the registry already dropped the session; later
     *              calls then report {@link SessionNotFoundException}
     * @throws SessionAlreadyCompletedException if not evicting and the session is DONE or FAILED
     */
    synchronized TurnResult cancel(String reason, boolean evict) {
        if (evict) {
            evicted = true;
        }
        SessionPhase phase = state.getPhase();
        if (phase == SessionPhase.CANCELLED) {
            return TurnResult.cancelled(id, state.getFailureReason());
        }
        if (phase.terminal()) {
            if (evict) {
                return terminalResult();
            }
            throw new SessionAlreadyCompletedException(id, phase);
        }

        state.cancel(reason);
        finished = true;
        CompletableFuture<String> waiter = answerWaiter;
        answerWaiter = null;
        if (waiter != null) {
            waiter.completeExceptionally(new SessionCancelledException(id, reason));
        }
        if (earlyTurn != null) {
            earlyTurn.complete(TurnResult.cancelled(id, reason));
            earlyTurn   = null;
            earlyAnswer = null;
        }
        log.info("Session {} cancelled at question {}: {}", id, state.getQuestionIndex(), reason);
        return TurnResult.cancelled(id, reason);
    }

    synchronized SessionSnapshot snapshot() {
        return state.snapshot(id);
    }

    /** The turn that will answer the currently shown prompt, if one is shown. */
    synchronized Optional<CompletableFuture<TurnResult>> pendingTurn() {
        return answerWaiter == null ? Optional.empty() : Optional.of(pendingTurn);
    }

    boolean idleSince(Instant cutoff) {
        return lastActivity.isBefore(cutoff);
    }

    /** True once DONE, CANCELLED or FAILED; readable without the monitor. */
    boolean isFinished() {
        return finished;
    }

    // ------------------------------------------------------------------
    // Turn loop (runs on a worker)
    // ------------------------------------------------------------------

    private TurnResult advance() {
        synchronized (this) {
            if (state.getPhase().terminal()) {
                return terminalResult();
            }
            Optional<String> prompt;
            try {
                machine.checkInvariants(state);
                prompt = machine.nextPrompt(state);
            } catch (RuntimeException e) {
                return failSession(e);
            }
            if (prompt.isPresent()) {
                CompletableFuture<String> waiter = new CompletableFuture<>();
                answerWaiter = waiter;
                pendingTurn  = waiter.handleAsync((answer, error) -> withMdc(() -> resume(answer, error)), worker);
                firstPromptIssued = true;
                lastActivity = clock.instant();
                log.debug("Session {} asked: {}", id, prompt.get());

                TurnResult result = TurnResult.prompt(id, prompt.get());
                if (earlyAnswer != null) {
                    deliverEarlyAnswer();
                }
                return result;
            }
        }
        return finish();
    }

    /**
     * Take the answer under the monitor, evaluate it without the monitor, then
     * apply the evaluation unless the session ended in the meantime.
     */
    private TurnResult resume(String answer, Throwable error) {
        PendingAnswer pending;
        synchronized (this) {
            if (error != null || state.getPhase().terminal()) {
                return terminalResult();
            }
            try {
                pending = machine.accept(state, answer);
            } catch (RuntimeException e) {
                return failSession(e);
            }
        }

        Evaluation evaluation = null;
        JudgeException unavailable = null;
        try {
            evaluation = machine.evaluate(pending);
        } catch (JudgeException e) {
            unavailable = e;
        } catch (RuntimeException e) {
            return failSession(e);
        }

        synchronized (this) {
            if (state.getPhase().terminal()) {
                log.debug("Session {} ended during evaluation, discarding it", id);
                return terminalResult();
            }
            try {
                TurnOutcome outcome = unavailable == null
                        ? machine.apply(state, pending, evaluation)
                        : machine.applyUnavailable(state, pending, unavailable);
                meterRegistry.counter("interview.turns", "outcome", outcome.name().toLowerCase()).increment();
                machine.checkInvariants(state);
            } catch (RuntimeException e) {
                return failSession(e);
            }
        }
        return advance();
    }

    private void deliverEarlyAnswer() {
        String answer = earlyAnswer;
        CompletableFuture<TurnResult> target = earlyTurn;
        CompletableFuture<String> waiter = answerWaiter;
        earlyAnswer  = null;
        earlyTurn    = null;
        answerWaiter = null;
        pendingTurn.whenComplete((result, error) -> {
            if (error != null) {
                target.completeExceptionally(error);
            } else {
                target.complete(result);
            }
        });
        waiter.complete(answer);
    }

    /**
     * Review and report. Both stages degrade on judge or formatter failure;
     * they run outside the monitor, so the session can still be read or
     * cancelled while they are in flight.
     */
    private TurnResult finish() {
        List<AnsweredRecord> answers;
        synchronized (this) {
            if (state.getPhase().terminal()) {
                return terminalResult();
            }
            answers = List.copyOf(state.getAnswers());
        }

        InterviewReport report;
        try {
            ReviewSummary summary = reviewStage.review(config.jobDescription(), answers);
            synchronized (this) {
                if (state.getPhase().terminal()) {
                    return terminalResult();
                }
                state.setPhase(SessionPhase.REPORTING);
            }
            report = reviewStage.report(summary);
        } catch (RuntimeException e) {
            return failSession(e);
        }

        synchronized (this) {
            if (state.getPhase().terminal()) {
                return terminalResult();
            }
            state.setReport(report);
            state.setPhase(SessionPhase.DONE);
            finished = true;
            meterRegistry.counter("interview.sessions", "outcome", "completed").increment();
            if (report.error() != null) {
                log.warn("Session {} completed with a degraded report: {}", id, report.error());
            } else {
                log.info("Session {} completed, {} questions answered", id, answers.size());
            }
            return TurnResult.completed(id);
        }
    }

    /**
     * Move to FAILED and release whoever is waiting. A session that already
     * ended keeps its terminal phase.
     */
    private synchronized TurnResult failSession(RuntimeException e) {
        if (state.getPhase().terminal()) {
            return terminalResult();
        }
        String reason = e instanceof InternalInvariantViolationException
                ? e.getMessage()
                : "unexpected error: " + e;
        log.error("Session {} failed: {} state={}", id, reason, state.snapshot(id), e);
        state.fail(reason);
        finished     = true;
        answerWaiter = null;
        TurnResult failed = TurnResult.failed(id, reason);
        if (earlyTurn != null) {
            earlyTurn.complete(failed);
            earlyTurn   = null;
            earlyAnswer = null;
        }
        meterRegistry.counter("interview.sessions", "outcome", "failed").increment();
        return failed;
    }

    private TurnResult terminalResult() {
        return switch (state.getPhase()) {
            case DONE   -> TurnResult.completed(id);
            case FAILED -> TurnResult.failed(id, state.getFailureReason());
            default     -> TurnResult.cancelled(id, state.getFailureReason());
        };
    }

    private <T> T withMdc(Supplier<T> body) {
        MDC.put("sessionId", id);
        try {
            return body.get();
        } finally {
            MDC.remove("sessionId");
        }
    }
}
