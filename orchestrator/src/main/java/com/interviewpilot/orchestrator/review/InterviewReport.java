package com.interviewpilot.orchestrator.review;

/**
 * Final artefact of a finished session.
 *
 * @param document formatted report text (opaque to the engine), null only if formatting failed
 * @param error    review or formatting error, null when both succeeded
 */
public record InterviewReport(ReviewSummary summary, String document, String error) {}
