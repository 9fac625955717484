package com.interviewpilot.orchestrator.console;

import com.interviewpilot.orchestrator.config.JobConfigLoader;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.Question;
import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.model.TurnState;
import com.interviewpilot.orchestrator.review.InterviewReport;
import com.interviewpilot.orchestrator.review.ReviewSummary;
import com.interviewpilot.orchestrator.session.SessionManager;
import com.interviewpilot.orchestrator.session.TurnResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsoleInterviewRunnerTest {

    private static final String ID = "console-session";
    private static final InterviewConfig CONFIG = new InterviewConfig("Backend engineer",
            List.of(new Question("q1", "How would you cache?", List.of("redis"))), 2);

    @Mock SessionManager  sessionManager;
    @Mock JobConfigLoader jobConfigLoader;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private ConsoleInterviewRunner runner(String input) {
        return new ConsoleInterviewRunner(sessionManager, jobConfigLoader,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_answersEveryPromptThenPrintsReport() throws Exception {
        when(jobConfigLoader.loadDefault()).thenReturn(CONFIG);
        when(sessionManager.createSession(CONFIG)).thenReturn(TurnResult.prompt(ID, "How would you cache?"));
        when(sessionManager.submitAnswer(ID, "Redis")).thenReturn(TurnResult.completed(ID));
        ReviewSummary summary = new ReviewSummary("Backend engineer", List.of(), "Hire.", null, null);
        when(sessionManager.getState(ID)).thenReturn(new SessionSnapshot(ID, 1, List.of(), null, List.of(),
                Map.of(), SessionPhase.DONE, TurnState.REVIEWING, false,
                new InterviewReport(summary, "# Interview Report\nHire.", null), null));

        runner("Redis\n").run();

        String printed = out.toString(StandardCharsets.UTF_8);
        assertThat(printed)
                .contains("=== Interview: Backend engineer ===")
                .contains("Interviewer: How would you cache?")
                .contains("# Interview Report");
    }

    @Test
    void run_endOfInput_cancelsSession() throws Exception {
        when(jobConfigLoader.load("custom.json")).thenReturn(CONFIG);
        when(sessionManager.createSession(CONFIG)).thenReturn(TurnResult.prompt(ID, "How would you cache?"));
        when(sessionManager.cancel(ID)).thenReturn(TurnResult.cancelled(ID, "cancelled by caller"));

        runner("").run("custom.json");

        verify(sessionManager).cancel(ID);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Interview cancelled: cancelled by caller");
    }
}
