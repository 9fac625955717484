package com.interviewpilot.orchestrator.judge;

import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.Verdict;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorator that bounds every judge call by a wall-clock timeout and records
 * metrics for it.
 *
 * The delegate runs on a dedicated executor. A call that outlives the timeout
 * is cancelled with an interrupt, which frees its worker thread:
 * <pre>
 *   interview.judge.calls{operation, status="success|unavailable|timeout|malformed_response"}
 *   interview.judge.duration{operation="evaluate|summarize"}
 * </pre>
 * Any unexpected exception from the delegate is reported as UNAVAILABLE, so
 * callers only ever see {@link JudgeException}.
 */
public class BoundedJudge implements Judge {

    private static final Logger log = LoggerFactory.getLogger(BoundedJudge.class);

    private final Judge           delegate;
    private final ExecutorService executor;
    private final Duration        timeout;
    private final MeterRegistry   meterRegistry;

    public BoundedJudge(Judge delegate, ExecutorService executor,
                        Duration timeout, MeterRegistry meterRegistry) {
        this.delegate      = delegate;
        this.executor      = executor;
        this.timeout       = timeout;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Verdict evaluate(String question, String answer, List<String> expectedPoints) {
        return call("evaluate", () -> delegate.evaluate(question, answer, expectedPoints));
    }

    @Override
    public String summarize(String jobDescription, List<AnsweredRecord> answers) {
        return call("summarize", () -> delegate.summarize(jobDescription, answers));
    }

    private <T> T call(String operation, Callable<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        // A plain Future: cancel(true) must interrupt the worker, which CompletableFuture never does.
        Future<T> future = executor.submit(body);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            status = "timeout";
            log.warn("Judge {} timed out after {}", operation, timeout);
            throw new JudgeException(JudgeException.Kind.TIMEOUT,
                    operation + " did not complete within " + timeout, e);
        } catch (ExecutionException e) {
            JudgeException failure = e.getCause() instanceof JudgeException
                    ? (JudgeException) e.getCause()
                    : new JudgeException(JudgeException.Kind.UNAVAILABLE,
                            "unexpected error in judge " + operation + ": " + e.getCause(), e.getCause());
            status = failure.getKind().name().toLowerCase();
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            status = "unavailable";
            throw new JudgeException(JudgeException.Kind.UNAVAILABLE, operation + " interrupted", e);
        } finally {
            sample.stop(meterRegistry.timer("interview.judge.duration", "operation", operation));
            meterRegistry.counter("interview.judge.calls",
                    "operation", operation, "status", status).increment();
        }
    }
}
