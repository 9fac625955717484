package com.interviewpilot.orchestrator.api.dto;

/** Request body for POST /interviews/{id}/answers. An empty answer is allowed. */
public record AnswerRequest(String answer) {}
