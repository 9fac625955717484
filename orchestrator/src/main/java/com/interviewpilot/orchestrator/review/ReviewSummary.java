package com.interviewpilot.orchestrator.review;

import com.interviewpilot.orchestrator.model.AnsweredRecord;

import java.util.List;

/**
 * Whole-interview evaluation handed to the {@link ReportFormatter}.
 *
 * @param summaryText  the judge's assessment, null if the judge failed
 * @param averageScore mean score over evaluated answers, null if none was evaluated
 * @param error        why the judge summary is missing, null on success
 */
public record ReviewSummary(
        String               jobDescription,
        List<AnsweredRecord> answers,
        String               summaryText,
        Double               averageScore,
        String               error) {

    public ReviewSummary {
        answers = List.copyOf(answers);
    }

    public boolean succeeded() {
        return error == null;
    }
}
