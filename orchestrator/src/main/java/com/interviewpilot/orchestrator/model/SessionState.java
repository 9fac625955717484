package com.interviewpilot.orchestrator.model;

import com.interviewpilot.orchestrator.review.InterviewReport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate root of one interview session.
 *
 * Exactly one instance exists per session. It is owned by that session's
 * {@code InterviewSession} and mutated only from the session's own task;
 * everything outside the engine sees it through {@link #snapshot(String)}.
 */
public class SessionState {

    private int                         questionIndex = 0;
    private final Deque<FollowUp>       pendingFollowUps = new ArrayDeque<>();
    private String                      currentPrompt;
    private final List<AnsweredRecord>  answers = new ArrayList<>();
    private final Map<Integer, FollowUpState> followUpTracking = new TreeMap<>();
    private SessionPhase                phase = SessionPhase.INTERVIEWING;
    private TurnState                   turnState = TurnState.AWAITING_PROMPT;
    private InterviewReport             report;
    private String                      failureReason;

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public int              getQuestionIndex()    { return questionIndex; }
    public Deque<FollowUp>  getPendingFollowUps() { return pendingFollowUps; }
    public String           getCurrentPrompt()    { return currentPrompt; }
    public List<AnsweredRecord> getAnswers()      { return answers; }
    public SessionPhase     getPhase()            { return phase; }
    public TurnState        getTurnState()        { return turnState; }
    public InterviewReport  getReport()           { return report; }
    public String           getFailureReason()    { return failureReason; }

    public boolean isAwaitingAnswer() {
        return turnState == TurnState.AWAITING_ANSWER && phase == SessionPhase.INTERVIEWING;
    }

    public Map<Integer, FollowUpState> getFollowUpTracking() { return followUpTracking; }

    /** Lazily create the follow-up bookkeeping for a question index. */
    public FollowUpState followUpStateFor(int index) {
        return followUpTracking.computeIfAbsent(index, i -> new FollowUpState());
    }

    // ------------------------------------------------------------------
    // Mutators (called by the turn state machine and the owning session)
    // ------------------------------------------------------------------

    public void advanceQuestion()                  { this.questionIndex++; }
    public void setCurrentPrompt(String prompt)    { this.currentPrompt = prompt; }
    public void setPhase(SessionPhase phase)       { this.phase = phase; }
    public void setTurnState(TurnState turnState)  { this.turnState = turnState; }
    public void setReport(InterviewReport report)  { this.report = report; }
    public void appendAnswer(AnsweredRecord rec)   { this.answers.add(rec); }

    /** Terminal failure: nothing is pending any more. */
    public void fail(String reason) {
        this.failureReason = reason;
        this.phase = SessionPhase.FAILED;
        this.pendingFollowUps.clear();
        this.currentPrompt = null;
    }

    public void cancel(String reason) {
        this.failureReason = reason;
        this.phase = SessionPhase.CANCELLED;
        this.pendingFollowUps.clear();
        this.currentPrompt = null;
    }

    // ------------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------------

    public SessionSnapshot snapshot(String sessionId) {
        Map<Integer, FollowUpState.Summary> tracking = new TreeMap<>();
        followUpTracking.forEach((i, f) -> tracking.put(i, f.summary()));
        return new SessionSnapshot(
                sessionId,
                questionIndex,
                pendingFollowUps.stream().map(FollowUp::prompt).toList(),
                currentPrompt,
                List.copyOf(answers),
                tracking,
                phase,
                turnState,
                isAwaitingAnswer(),
                report,
                failureReason
        );
    }
}
