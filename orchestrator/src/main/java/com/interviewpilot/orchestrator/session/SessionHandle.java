package com.interviewpilot.orchestrator.session;

import java.util.concurrent.CompletableFuture;

/**
 * A freshly opened session whose first prompt may still be in preparation.
 * Until {@code firstTurn} completes, the session buffers one early answer.
 */
public record SessionHandle(String sessionId, CompletableFuture<TurnResult> firstTurn) {}
