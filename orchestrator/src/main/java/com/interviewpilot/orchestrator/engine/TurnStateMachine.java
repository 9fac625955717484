package com.interviewpilot.orchestrator.engine;

import com.interviewpilot.orchestrator.evaluation.AnswerEvaluator;
import com.interviewpilot.orchestrator.evaluation.Evaluation;
import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.FollowUp;
import com.interviewpilot.orchestrator.model.FollowUpState;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import com.interviewpilot.orchestrator.model.Question;
import com.interviewpilot.orchestrator.model.SessionPhase;
import com.interviewpilot.orchestrator.model.SessionState;
import com.interviewpilot.orchestrator.model.TurnState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Question/follow-up sequencing for one interview session.
 *
 * <pre>
 *   AWAITING_PROMPT ──nextPrompt()──▶ AWAITING_ANSWER ──submit()──▶ EVALUATING
 *         ▲                                                           │
 *         └────────────── follow-up queued / index advanced ──────────┘
 *   AWAITING_PROMPT ──nextPrompt(), no questions left──▶ REVIEWING
 * </pre>
 *
 * Rules:
 *   - Follow-ups are asked before the next main question, in queue order.
 *   - An answer is always evaluated against the current MAIN question's full
 *     point set, even when it replies to a follow-up.
 *   - A question gets exactly one {@link AnsweredRecord}, written on its last
 *     evaluation, holding the final answer.
 *   - When a question resolves the follow-up queue is cleared, so nothing
 *     queued for it can leak into the next question.
 *
 * One instance per session. Not thread-safe: the owning session serialises
 * every call that touches the state. {@link #evaluate} touches none, so the
 * session may run it between {@link #accept} and {@link #apply} without
 * holding its lock.
 */
public class TurnStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TurnStateMachine.class);

    static final String EVALUATION_UNAVAILABLE_NOTE = "evaluation unavailable";

    private final InterviewConfig config;
    private final AnswerEvaluator evaluator;
    private final FollowUpPolicy  policy;

    public TurnStateMachine(InterviewConfig config, AnswerEvaluator evaluator, FollowUpPolicy defaultPolicy) {
        this.config    = config;
        this.evaluator = evaluator;
        this.policy    = config.followUpPolicy() != null ? config.followUpPolicy() : defaultPolicy;
    }

    public FollowUpPolicy policy() {
        return policy;
    }

    // ------------------------------------------------------------------
    // AWAITING_PROMPT
    // ------------------------------------------------------------------

    /**
     * Decide the next action.
     *
     * @return the prompt to show (state moves to AWAITING_ANSWER), or empty when
     *         every question is resolved (state and phase move to REVIEWING)
     * @throws InternalInvariantViolationException if the state is inconsistent
     */
    public Optional<String> nextPrompt(SessionState state) {
        require(state.getTurnState() == TurnState.AWAITING_PROMPT,
                "nextPrompt called in turn state " + state.getTurnState());
        require(state.getPhase() == SessionPhase.INTERVIEWING,
                "nextPrompt called in phase " + state.getPhase());
        int index = state.getQuestionIndex();

        if (!state.getPendingFollowUps().isEmpty()) {
            require(index < config.questionCount(),
                    "follow-ups pending while question index " + index
                            + " is past the last question (" + config.questionCount() + ")");
            String prompt = state.getPendingFollowUps().poll().prompt();
            return Optional.of(emit(state, prompt));
        }

        if (index < config.questionCount()) {
            return Optional.of(emit(state, config.question(index).text()));
        }

        state.setCurrentPrompt(null);
        state.setTurnState(TurnState.REVIEWING);
        state.setPhase(SessionPhase.REVIEWING);
        log.info("All {} questions resolved, handing over to review", config.questionCount());
        return Optional.empty();
    }

    private String emit(SessionState state, String prompt) {
        state.setCurrentPrompt(prompt);
        state.setTurnState(TurnState.AWAITING_ANSWER);
        return prompt;
    }

    // ------------------------------------------------------------------
    // AWAITING_ANSWER → EVALUATING → AWAITING_PROMPT
    // ------------------------------------------------------------------

    /**
     * Deliver an answer to the prompt last emitted and evaluate it in one step.
     *
     * Judge failures are absorbed here: the question is recorded with an
     * "evaluation unavailable" note and the index advances.
     *
     * @param answer may be null or empty; stored stripped
     */
    public TurnOutcome submit(SessionState state, String answer) {
        PendingAnswer pending = accept(state, answer);
        Evaluation evaluation;
        try {
            evaluation = evaluate(pending);
        } catch (JudgeException e) {
            return applyUnavailable(state, pending, e);
        }
        return apply(state, pending, evaluation);
    }

    /**
     * First half of {@link #submit}: take the answer and move to EVALUATING.
     * The returned value carries everything {@link #evaluate} needs, so the
     * evaluation itself can run without touching the state.
     */
    public PendingAnswer accept(SessionState state, String answer) {
        require(state.getTurnState() == TurnState.AWAITING_ANSWER,
                "answer delivered in turn state " + state.getTurnState());
        int index = state.getQuestionIndex();
        require(index < config.questionCount(),
                "answer delivered while question index " + index + " is past the last question");
        state.setTurnState(TurnState.EVALUATING);
        return new PendingAnswer(index, config.question(index), answer == null ? "" : answer.strip());
    }

    /** Run the evaluator. Reads nothing but {@code pending}. */
    public Evaluation evaluate(PendingAnswer pending) throws JudgeException {
        return evaluator.evaluate(pending.question(), pending.answer());
    }

    /** Second half of {@link #submit}: fold a finished evaluation into the state. */
    public TurnOutcome apply(SessionState state, PendingAnswer pending, Evaluation evaluation) {
        requireEvaluating(state, pending);
        Question question = pending.question();
        String text = pending.answer();
        FollowUpState tracking = state.followUpStateFor(pending.questionIndex());

        if (evaluation.verdict() != null) {
            tracking.recordVerdict(evaluation.verdict());
        }
        Double score = evaluation.verdict() == null ? null : evaluation.verdict().overallScore();

        if (!evaluation.hasGap()) {
            resolve(state, question, text, List.of(), question.guidance(), tracking, score);
            log.info("Question '{}' resolved after {} follow-up(s)", question.id(), tracking.getFollowUpCount());
            return TurnOutcome.RESOLVED;
        }

        List<FollowUp> queue = policy.plan(tracking, evaluation, state.getPendingFollowUps(),
                config.maxFollowupChances());
        if (queue.isEmpty()) {
            resolve(state, question, text, evaluation.missing(), question.guidance(), tracking, score);
            log.info("Question '{}' follow-up budget exhausted ({}/{}), still missing {}",
                    question.id(), tracking.getFollowUpCount(), config.maxFollowupChances(),
                    evaluation.missing());
            return TurnOutcome.EXHAUSTED;
        }

        state.getPendingFollowUps().clear();
        state.getPendingFollowUps().addAll(queue);
        state.setTurnState(TurnState.AWAITING_PROMPT);
        log.debug("Question '{}' missing {}, queued {} follow-up(s) (chance {}/{})",
                question.id(), evaluation.missing(), queue.size(),
                tracking.getFollowUpCount(), config.maxFollowupChances());
        return TurnOutcome.FOLLOW_UP;
    }

    /** Record the question unevaluated after the evaluator gave up. */
    public TurnOutcome applyUnavailable(SessionState state, PendingAnswer pending, JudgeException failure) {
        requireEvaluating(state, pending);
        Question question = pending.question();
        log.warn("Evaluation of question '{}' unavailable ({}), recording it unevaluated: {}",
                question.id(), failure.getKind(), failure.getMessage());
        String note = join(question.guidance(),
                EVALUATION_UNAVAILABLE_NOTE + " (" + failure.getKind().name().toLowerCase() + ")");
        resolve(state, question, pending.answer(), question.requiredKeywords(), note,
                state.followUpStateFor(pending.questionIndex()), null);
        return TurnOutcome.UNEVALUATED;
    }

    private static void requireEvaluating(SessionState state, PendingAnswer pending) {
        require(state.getTurnState() == TurnState.EVALUATING,
                "evaluation applied in turn state " + state.getTurnState());
        require(state.getQuestionIndex() == pending.questionIndex(),
                "evaluation for question " + pending.questionIndex()
                        + " applied at question " + state.getQuestionIndex());
    }

    /** Record the final answer for the current question and move past it. */
    private void resolve(SessionState state, Question question, String answer, List<String> missing,
                         String notes, FollowUpState tracking, Double score) {
        state.appendAnswer(new AnsweredRecord(
                question.id(),
                question.text(),
                answer,
                missing,
                notes,
                tracking.getFollowUpCount(),
                score));
        state.getPendingFollowUps().clear();
        state.advanceQuestion();
        state.setTurnState(TurnState.AWAITING_PROMPT);
    }

    // ------------------------------------------------------------------
    // Invariants
    // ------------------------------------------------------------------

    /**
     * Check the session-level invariants at an evaluation boundary.
     *
     * @throws InternalInvariantViolationException on the first violation found
     */
    public void checkInvariants(SessionState state) {
        int index = state.getQuestionIndex();
        require(index >= 0 && index <= config.questionCount(),
                "question index " + index + " out of range");
        require(state.getPendingFollowUps().isEmpty() || state.getPhase() == SessionPhase.INTERVIEWING,
                "follow-ups pending in phase " + state.getPhase());
        state.getFollowUpTracking().forEach((i, f) -> require(
                f.getFollowUpCount() <= config.maxFollowupChances(),
                "question " + i + " used " + f.getFollowUpCount() + " follow-ups, max is "
                        + config.maxFollowupChances()));
        require(state.getAnswers().size() == index,
                state.getAnswers().size() + " answers recorded but question index is " + index);
        require(state.getPendingFollowUps().isEmpty() || index < config.questionCount(),
                "follow-ups pending while question index " + index + " is past the last question");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InternalInvariantViolationException(message);
        }
    }

    private static String join(String guidance, String note) {
        return guidance == null || guidance.isBlank() ? note : guidance + " | " + note;
    }
}
