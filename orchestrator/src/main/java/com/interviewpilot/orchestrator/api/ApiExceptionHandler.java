package com.interviewpilot.orchestrator.api;

import com.interviewpilot.orchestrator.config.ConfigInvalidException;
import com.interviewpilot.orchestrator.session.NoPendingQuestionException;
import com.interviewpilot.orchestrator.session.SessionAlreadyCompletedException;
import com.interviewpilot.orchestrator.session.SessionLimitExceededException;
import com.interviewpilot.orchestrator.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps interview engine exceptions to HTTP statuses with a consistent JSON body:
 * <pre>
 *   {"timestamp": ..., "status": 404, "error": "session_not_found", "message": ..., "sessionId": ...}
 * </pre>
 *
 * ConfigInvalid → 400, SessionNotFound → 404, SessionAlreadyCompleted and
 * NoPendingQuestion → 409, SessionLimitExceeded → 429.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigInvalidException.class)
    public ResponseEntity<Map<String, Object>> handleConfigInvalid(ConfigInvalidException ex) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "config_invalid", ex, null);
        body.put("problems", ex.getProblems());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "malformed_request", ex, null));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SessionNotFoundException ex) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(body(status, "session_not_found", ex, ex.getSessionId()));
    }

    @ExceptionHandler(SessionAlreadyCompletedException.class)
    public ResponseEntity<Map<String, Object>> handleCompleted(SessionAlreadyCompletedException ex) {
        HttpStatus status = HttpStatus.CONFLICT;
        Map<String, Object> body = body(status, "session_already_completed", ex, ex.getSessionId());
        body.put("phase", ex.getPhase().name());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(NoPendingQuestionException.class)
    public ResponseEntity<Map<String, Object>> handleNoPending(NoPendingQuestionException ex) {
        HttpStatus status = HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(body(status, "no_pending_question", ex, ex.getSessionId()));
    }

    @ExceptionHandler(SessionLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleLimit(SessionLimitExceededException ex) {
        HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
        log.warn("Rejected new interview session: {}", ex.getMessage());
        return ResponseEntity.status(status).body(body(status, "session_limit_exceeded", ex, null));
    }

    private static Map<String, Object> body(HttpStatus status, String code, Exception ex, String sessionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", ex.getMessage());
        if (sessionId != null) {
            body.put("sessionId", sessionId);
        }
        return body;
    }
}
