package com.interviewpilot.orchestrator.config;

import java.util.List;

/**
 * The interview configuration cannot be used (malformed question set,
 * unreadable file, negative budget). Fatal at session creation.
 */
public class ConfigInvalidException extends RuntimeException {

    private final List<String> problems;

    public ConfigInvalidException(List<String> problems) {
        super("Invalid interview configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super("Invalid interview configuration: " + message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() { return problems; }
}
