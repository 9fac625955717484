package com.interviewpilot.orchestrator.api.dto;

import com.interviewpilot.orchestrator.model.InterviewConfig;

/**
 * Request body for POST /interviews.
 *
 * Optional: config — an inline job config in the job_config.json shape.
 * When absent (or when the body is omitted) the configured default job is used.
 */
public record StartInterviewRequest(InterviewConfig config) {}
