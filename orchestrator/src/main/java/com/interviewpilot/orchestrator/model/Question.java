package com.interviewpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One main interview question, as loaded from the job configuration.
 *
 * Immutable once loaded. The required keywords double as the "expected points"
 * handed to the judge when judge-based evaluation is enabled.
 *
 * @param id               Unique within the configuration (e.g. "q1").
 * @param text             The prompt shown to the candidate.
 * @param requiredKeywords Points the answer must cover, in the order follow-ups are asked.
 * @param guidance         Interviewer notes copied into the answered record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Question(
        @JsonProperty("id")                String       id,
        @JsonProperty("text")              String       text,
        @JsonProperty("required_keywords") List<String> requiredKeywords,
        @JsonProperty("guidance")          String       guidance) {

    // Compact constructor: normalise optional fields so callers never see null.
    public Question {
        requiredKeywords = requiredKeywords == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(requiredKeywords));
        if (guidance == null) guidance = "";
    }

    public Question(String id, String text, List<String> requiredKeywords) {
        this(id, text, requiredKeywords, "");
    }
}
