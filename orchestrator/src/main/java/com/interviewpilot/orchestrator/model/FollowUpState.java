package com.interviewpilot.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Follow-up bookkeeping for one question index.
 *
 * Created lazily on the first evaluation of that question and mutated only by
 * the turn state machine of the owning session.
 */
public class FollowUpState {

    private int followUpCount;
    private final List<Verdict> history = new ArrayList<>();

    // Only used by the per-keyword budget policy.
    private final Map<String, Integer> attemptsByPoint = new LinkedHashMap<>();

    public int           getFollowUpCount() { return followUpCount; }
    public List<Verdict> getHistory()       { return Collections.unmodifiableList(history); }

    public void incrementFollowUpCount()    { this.followUpCount++; }
    public void setFollowUpCount(int v)     { this.followUpCount = v; }
    public void recordVerdict(Verdict v)    { this.history.add(v); }

    public int attemptsFor(String point) {
        return attemptsByPoint.getOrDefault(point, 0);
    }

    /** Increment the per-point counter and return the new value. */
    public int incrementAttempts(String point) {
        return attemptsByPoint.merge(point, 1, Integer::sum);
    }

    public Summary summary() {
        return new Summary(followUpCount, List.copyOf(history));
    }

    /** Read-only copy exposed through session snapshots. */
    public record Summary(int followUpCount, List<Verdict> history) {}
}
