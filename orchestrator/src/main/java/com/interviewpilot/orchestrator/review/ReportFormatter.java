package com.interviewpilot.orchestrator.review;

/** Turns a review summary into a displayable document; the engine treats the output as opaque. */
public interface ReportFormatter {

    String format(ReviewSummary summary);
}
