package com.interviewpilot.orchestrator.api.dto;

import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.SessionSnapshot;
import com.interviewpilot.orchestrator.review.InterviewReport;

import java.util.List;

/**
 * Response body for GET /interviews/{id}/report once the session is DONE.
 *
 * document is the formatted (Markdown) report; error is set when the judge
 * summary or the formatting failed, in which case the rest is still usable.
 */
public record ReportResponse(
        String               sessionId,
        String               document,
        String               summary,
        Double               averageScore,
        List<AnsweredRecord> answers,
        String               error
) {
    public static ReportResponse from(SessionSnapshot snapshot) {
        InterviewReport report = snapshot.report();
        return new ReportResponse(
                snapshot.sessionId(),
                report.document(),
                report.summary().summaryText(),
                report.summary().averageScore(),
                snapshot.answers(),
                report.error()
        );
    }
}
