package com.interviewpilot.orchestrator.console;

import com.interviewpilot.orchestrator.config.JobConfigLoader;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.review.InterviewReport;
import com.interviewpilot.orchestrator.session.SessionManager;
import com.interviewpilot.orchestrator.session.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs one interview on the terminal at startup: print the prompt, read a
 * line, repeat, then print the report.
 *
 * Enabled with {@code interview.console.enabled=true}. End of input cancels
 * the interview.
 */
@Component
@ConditionalOnProperty(name = "interview.console.enabled", havingValue = "true")
public class ConsoleInterviewRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleInterviewRunner.class);

    private final SessionManager  sessionManager;
    private final JobConfigLoader jobConfigLoader;
    private final InputStream     in;
    private final PrintStream     out;

    public ConsoleInterviewRunner(SessionManager sessionManager, JobConfigLoader jobConfigLoader) {
        this(sessionManager, jobConfigLoader, System.in, System.out);
    }

    ConsoleInterviewRunner(SessionManager sessionManager, JobConfigLoader jobConfigLoader,
                           InputStream in, PrintStream out) {
        this.sessionManager  = sessionManager;
        this.jobConfigLoader = jobConfigLoader;
        this.in              = in;
        this.out             = out;
    }

    @Override
    public void run(String... args) throws IOException {
        InterviewConfig config = args.length > 0
                ? jobConfigLoader.load(args[0])
                : jobConfigLoader.loadDefault();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        out.println("=== Interview: " + config.jobDescription() + " ===");
        TurnResult turn = sessionManager.createSession(config);
        String sessionId = turn.sessionId();

        while (!turn.done()) {
            if (turn.prompt() == null) {
                // First prompt still being prepared.
                turn = awaitFirstPrompt(sessionId);
                continue;
            }
            out.println();
            out.println("Interviewer: " + turn.prompt());
            out.print("> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                log.info("Console input closed, cancelling session {}", sessionId);
                turn = sessionManager.cancel(sessionId);
                break;
            }
            turn = sessionManager.submitAnswer(sessionId, line);
        }

        out.println();
        if (turn.cancelled()) {
            out.println("Interview cancelled: " + turn.message());
            return;
        }
        SessionSnapshot snapshot = sessionManager.getState(sessionId);
        InterviewReport report = snapshot.report();
        if (report == null) {
            out.println("Interview ended without a report: " + turn.message());
        } else if (report.document() != null) {
            out.println(report.document());
        } else {
            out.println("Report unavailable: " + report.error());
        }
    }

    private TurnResult awaitFirstPrompt(String sessionId) {
        SessionSnapshot snapshot = sessionManager.getState(sessionId);
        if (snapshot.currentPrompt() != null) {
            return TurnResult.prompt(sessionId, snapshot.currentPrompt());
        }
        if (snapshot.phase().terminal()) {
            return new TurnResult(sessionId, null, true, snapshot.phase() == SessionPhase.CANCELLED,
                    snapshot.phase(), snapshot.failureReason());
        }
        try {
            Thread.sleep(100);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return sessionManager.cancel(sessionId);
        }
        return TurnResult.starting(sessionId);
    }
}
