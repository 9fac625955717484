package com.interviewpilot.orchestrator.review;

import com.interviewpilot.orchestrator.judge.Judge;
import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.AnsweredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Post-interview stage: one judge summary over the full answer set, then
 * formatting.
 *
 * Both steps degrade instead of failing: a judge error is recorded in the
 * summary, a formatter error in the report. The answers list is only read.
 */
@Component
public class ReviewStage {

    private static final Logger log = LoggerFactory.getLogger(ReviewStage.class);

    private final Judge           judge;
    private final ReportFormatter formatter;

    public ReviewStage(Judge judge, ReportFormatter formatter) {
        this.judge     = judge;
        this.formatter = formatter;
    }

    /** Summarise the interview with a single judge call (not one per question). */
    public ReviewSummary review(String jobDescription, List<AnsweredRecord> answers) {
        List<AnsweredRecord> frozen = List.copyOf(answers);
        Double average = averageScore(frozen);
        try {
            String text = judge.summarize(jobDescription, frozen);
            log.info("Review summary produced for {} answers", frozen.size());
            return new ReviewSummary(jobDescription, frozen, text, average, null);
        } catch (JudgeException e) {
            log.warn("Review summary unavailable ({}): {}", e.getKind(), e.getMessage());
            return new ReviewSummary(jobDescription, frozen, null, average,
                    "judge " + e.getKind().name().toLowerCase() + ": " + e.getMessage());
        }
    }

    /** Format the summary into the final report document. */
    public InterviewReport report(ReviewSummary summary) {
        try {
            String document = formatter.format(summary);
            return new InterviewReport(summary, document, summary.error());
        } catch (RuntimeException e) {
            log.error("Report formatting failed: {}", e.getMessage(), e);
            String error = summary.error() == null
                    ? "formatting failed: " + e.getMessage()
                    : summary.error() + "; formatting failed: " + e.getMessage();
            return new InterviewReport(summary, null, error);
        }
    }

    private static Double averageScore(List<AnsweredRecord> answers) {
        OptionalDouble avg = answers.stream()
                .map(AnsweredRecord::score)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }
}
