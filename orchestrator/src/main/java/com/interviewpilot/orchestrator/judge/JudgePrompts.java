package com.interviewpilot.orchestrator.judge;

import com.interviewpilot.orchestrator.model.AnsweredRecord;

import java.util.List;

/**
 * Prompt text for the Claude-backed judge.
 *
 * The evaluation prompt pins the JSON contract that {@link ClaudeJudge}
 * parses; change both together.
 */
final class JudgePrompts {

    private JudgePrompts() {}

    static final String EVALUATE_SYSTEM = """
            You are a strict technical interviewer grading one answer.

            For every expected point decide whether the candidate's answer:
              - "present"   : mentions the point,
              - "explained" : mentions it and explains how or why,
              - "missing"   : does not cover it.

            Reply with ONLY a JSON object, no prose:
            {
              "points":    { "<expected point>": "present" | "explained" | "missing", ... },
              "score":     <number from 0 to 10>,
              "follow_up": "<one short question probing the most important missing point>" | null
            }
            Use the expected points verbatim as keys. Set follow_up to null when nothing is missing.
            """;

    static final String SUMMARIZE_SYSTEM = """
            You are a hiring panel member writing the evaluation of a finished interview.
            Given the job description and the candidate's final answers, write a concise
            assessment (at most 200 words): strengths, gaps against the role, and an
            overall hiring recommendation. Plain text only.
            """;

    static String evaluateUser(String question, String answer, List<String> expectedPoints) {
        StringBuilder sb = new StringBuilder();
        sb.append("QUESTION:\n").append(question).append("\n\n");
        sb.append("EXPECTED POINTS:\n");
        expectedPoints.forEach(p -> sb.append("- ").append(p).append('\n'));
        sb.append("\nANSWER:\n").append(answer == null || answer.isBlank() ? "(no answer)" : answer);
        return sb.toString();
    }

    static String summarizeUser(String jobDescription, List<AnsweredRecord> answers) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== JOB DESCRIPTION ===\n").append(jobDescription).append("\n\n");
        sb.append("=== ANSWERS ===\n");
        for (AnsweredRecord a : answers) {
            sb.append("Q (").append(a.questionId()).append("): ").append(a.questionText()).append('\n');
            sb.append("A: ").append(a.answerText().isBlank() ? "(no answer)" : a.answerText()).append('\n');
            if (!a.missing().isEmpty()) {
                sb.append("Missing points: ").append(String.join(", ", a.missing())).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
