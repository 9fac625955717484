package com.interviewpilot.orchestrator.engine;

import com.interviewpilot.orchestrator.model.Question;

/** An answer taken by {@link TurnStateMachine#accept} and not yet evaluated. */
public record PendingAnswer(int questionIndex, Question question, String answer) {}
