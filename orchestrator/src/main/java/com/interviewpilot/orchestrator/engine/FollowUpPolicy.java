package com.interviewpilot.orchestrator.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.interviewpilot.orchestrator.evaluation.Evaluation;
import com.interviewpilot.orchestrator.model.FollowUp;
import com.interviewpilot.orchestrator.model.FollowUpState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * How the follow-up budget of a question is scoped.
 *
 * Both policies return the complete follow-up queue for the question after an
 * evaluation with a gap. An empty list means the budget is exhausted and the
 * question must be resolved with the gaps it still has.
 */
public enum FollowUpPolicy {

    /**
     * One counter per question. Each round with a gap spends one chance and
     * re-plans the queue from the current gaps: the judge's single suggestion
     * if it made one, otherwise one follow-up per missing point.
     */
    PER_QUESTION {
        @Override
        public List<FollowUp> plan(FollowUpState tracking, Evaluation evaluation,
                                   Collection<FollowUp> pending, int maxChances) {
            if (tracking.getFollowUpCount() >= maxChances) {
                return List.of();
            }
            tracking.incrementFollowUpCount();
            if (evaluation.suggestedFollowUp() != null) {
                return List.of(new FollowUp(null, evaluation.suggestedFollowUp()));
            }
            return evaluation.missing().stream().map(FollowUp::forPoint).toList();
        }
    },

    /**
     * One counter per missing point. Queued follow-ups whose point is still
     * missing stay queued; other missing points get a fresh follow-up while
     * their own counter is below the maximum. The question's follow-up count
     * is the highest per-point counter.
     */
    PER_KEYWORD {
        @Override
        public List<FollowUp> plan(FollowUpState tracking, Evaluation evaluation,
                                   Collection<FollowUp> pending, int maxChances) {
            List<FollowUp> queue = new ArrayList<>();
            for (FollowUp queued : pending) {
                if (queued.point() != null && evaluation.missing().contains(queued.point())) {
                    queue.add(queued);
                }
            }
            for (String point : evaluation.missing()) {
                boolean alreadyQueued = queue.stream().anyMatch(f -> point.equals(f.point()));
                if (alreadyQueued || tracking.attemptsFor(point) >= maxChances) {
                    continue;
                }
                int attempts = tracking.incrementAttempts(point);
                tracking.setFollowUpCount(Math.max(tracking.getFollowUpCount(), attempts));
                queue.add(FollowUp.forPoint(point));
            }
            return queue;
        }
    };

    /**
     * Plan the follow-up queue after an evaluation that found a gap.
     *
     * @param tracking   the question's bookkeeping; counters are updated in place
     * @param pending    follow-ups still queued for this question (not yet asked)
     * @param maxChances configured maximum follow-up chances
     * @return the new queue, empty when the budget is exhausted
     */
    public abstract List<FollowUp> plan(FollowUpState tracking, Evaluation evaluation,
                                        Collection<FollowUp> pending, int maxChances);

    @JsonValue
    public String propertyName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses "per_question" / "per-keyword" etc. (any case, '-' or '_'). */
    @JsonCreator
    public static FollowUpPolicy fromProperty(String value) {
        try {
            return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    "follow-up policy must be 'per_question' or 'per_keyword', was '" + value + "'", e);
        }
    }
}
