package com.interviewpilot.orchestrator.api;

import com.interviewpilot.orchestrator.api.dto.AnswerRequest;
import com.interviewpilot.orchestrator.api.dto.ReportResponse;
import com.interviewpilot.orchestrator.api.dto.StartInterviewRequest;
import com.interviewpilot.orchestrator.api.dto.TurnResponse;
import com.interviewpilot.orchestrator.config.JobConfigLoader;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.session.SessionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * REST API for interview sessions.
 *
 * POST   /interviews               — start an interview, returns the first prompt
 * POST   /interviews/{id}/answers  — answer the current prompt, returns the next turn
 * GET    /interviews/{id}          — snapshot of the session state
 * DELETE /interviews/{id}          — cancel the interview
 * GET    /interviews/{id}/report   — final report once the interview is done
 *
 * Domain errors are mapped to statuses by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/interviews")
public class InterviewController {

    private final SessionManager  sessionManager;
    private final JobConfigLoader jobConfigLoader;

    public InterviewController(SessionManager sessionManager, JobConfigLoader jobConfigLoader) {
        this.sessionManager  = sessionManager;
        this.jobConfigLoader = jobConfigLoader;
    }

    /**
     * Start an interview.
     *
     * Example:
     *   curl -X POST http://localhost:8080/interviews \
     *     -H "Content-Type: application/json" \
     *     -d '{"config":{"job_description":"Backend engineer","questions":[
     *          {"id":"q1","text":"How would you cache product pages?","required_keywords":["redis","ttl"]}]}}'
     */
    @PostMapping
    public ResponseEntity<TurnResponse> start(@RequestBody(required = false) StartInterviewRequest req) {
        InterviewConfig config = req != null && req.config() != null
                ? req.config()
                : jobConfigLoader.loadDefault();
        TurnResponse body = TurnResponse.from(sessionManager.createSession(config));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/{id}/answers")
    public TurnResponse answer(@PathVariable String id, @RequestBody AnswerRequest req) {
        return TurnResponse.from(sessionManager.submitAnswer(id, req.answer()));
    }

    @GetMapping("/{id}")
    public SessionSnapshot getState(@PathVariable String id) {
        return sessionManager.getState(id);
    }

    @DeleteMapping("/{id}")
    public TurnResponse cancel(@PathVariable String id) {
        return TurnResponse.from(sessionManager.cancel(id));
    }

    /**
     * HTTP 200 — interview is DONE, report available
     * HTTP 202 — interview or review still running
     * HTTP 409 — session was cancelled or failed, no report will exist
     * HTTP 404 — unknown or evicted session
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<?> getReport(@PathVariable String id) {
        SessionSnapshot snapshot = sessionManager.getState(id);
        if (snapshot.phase() == SessionPhase.DONE && snapshot.report() != null) {
            return ResponseEntity.ok(ReportResponse.from(snapshot));
        }
        if (snapshot.phase().terminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "No report for session " + id + ": it is " + snapshot.phase());
        }
        return ResponseEntity.accepted()
                .body(Map.of("status", "pending", "phase", snapshot.phase().name()));
    }
}
