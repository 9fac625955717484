package com.interviewpilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.interviewpilot.orchestrator.config.ConfigInvalidException;
import com.interviewpilot.orchestrator.engine.FollowUpPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-session interview configuration.
 *
 * Passed explicitly when a session is created, so concurrent sessions can run
 * with different question sets and budgets.
 *
 * @param followUpPolicy optional; null means "use the engine default"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InterviewConfig(
        @JsonProperty("job_description")      String         jobDescription,
        @JsonProperty("questions")            List<Question> questions,
        @JsonProperty("max_followup_chances") Integer        maxFollowupChances,
        @JsonProperty("follow_up_policy")     FollowUpPolicy followUpPolicy) {

    public static final int DEFAULT_MAX_FOLLOWUP_CHANCES = 2;

    public InterviewConfig {
        if (jobDescription == null) jobDescription = "";
        if (maxFollowupChances == null) maxFollowupChances = DEFAULT_MAX_FOLLOWUP_CHANCES;
        questions = questions == null ? null : Collections.unmodifiableList(new ArrayList<>(questions));
    }

    public InterviewConfig(String jobDescription, List<Question> questions, int maxFollowupChances) {
        this(jobDescription, questions, maxFollowupChances, null);
    }

    public Question question(int index) {
        return questions.get(index);
    }

    public int questionCount() {
        return questions.size();
    }

    public InterviewConfig withDefaultPolicy(FollowUpPolicy fallback) {
        return followUpPolicy != null
                ? this
                : new InterviewConfig(jobDescription, questions, maxFollowupChances, fallback);
    }

    /**
     * Check the question set is usable.
     *
     * @return this, for chaining
     * @throws ConfigInvalidException listing every problem found
     */
    public InterviewConfig validate() {
        List<String> problems = new ArrayList<>();
        if (questions == null || questions.isEmpty()) {
            problems.add("at least one question is required");
        } else {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < questions.size(); i++) {
                Question q = questions.get(i);
                if (q == null) {
                    problems.add("questions[" + i + "] is null");
                    continue;
                }
                if (q.id() == null || q.id().isBlank()) {
                    problems.add("questions[" + i + "].id is blank");
                } else if (!seen.add(q.id())) {
                    problems.add("duplicate question id '" + q.id() + "'");
                }
                if (q.text() == null || q.text().isBlank()) {
                    problems.add("questions[" + i + "].text is blank");
                }
                if (q.requiredKeywords().stream().anyMatch(k -> k == null || k.isBlank())) {
                    problems.add("questions[" + i + "].required_keywords contains a blank keyword");
                }
            }
        }
        if (maxFollowupChances < 0) {
            problems.add("max_followup_chances must be >= 0, was " + maxFollowupChances);
        }
        if (!problems.isEmpty()) {
            throw new ConfigInvalidException(problems);
        }
        return this;
    }
}
