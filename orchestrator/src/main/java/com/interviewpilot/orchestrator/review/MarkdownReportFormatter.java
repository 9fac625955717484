package com.interviewpilot.orchestrator.review;

import com.interviewpilot.orchestrator.model.AnsweredRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Markdown report: one block per question, then the overall assessment.
 *
 * <pre>
 *   ## Q (q1): Describe your caching experience
 *   **A:** yes with TTL expiry
 *   - Missing keywords: —
 *   - Score: 10.0 / 10
 * </pre>
 */
@Component
public class MarkdownReportFormatter implements ReportFormatter {

    @Override
    public String format(ReviewSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Interview Report\n\n");
        if (summary.jobDescription() != null && !summary.jobDescription().isBlank()) {
            sb.append("_Role:_ ").append(summary.jobDescription().strip()).append("\n\n");
        }

        for (AnsweredRecord a : summary.answers()) {
            sb.append("## Q (").append(a.questionId()).append("): ").append(a.questionText()).append('\n');
            sb.append("**A:** ").append(a.answerText().isBlank() ? "_(no answer)_" : a.answerText()).append('\n');
            sb.append("- Missing keywords: ")
              .append(a.missing().isEmpty() ? "—" : String.join(", ", a.missing())).append('\n');
            sb.append("- Follow-ups asked: ").append(a.followUpsAsked()).append('\n');
            if (a.score() != null) {
                sb.append("- Score: ").append(formatScore(a.score())).append(" / 10\n");
            }
            if (a.notes() != null && !a.notes().isBlank()) {
                sb.append("- Notes: ").append(a.notes()).append('\n');
            }
            sb.append('\n');
        }

        sb.append("## Overall assessment\n");
        if (summary.averageScore() != null) {
            sb.append("Average score: ").append(formatScore(summary.averageScore())).append(" / 10\n\n");
        }
        if (summary.succeeded()) {
            sb.append(summary.summaryText()).append('\n');
        } else {
            sb.append("_Assessment unavailable: ").append(summary.error()).append("_\n");
        }
        return sb.toString();
    }

    private static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
