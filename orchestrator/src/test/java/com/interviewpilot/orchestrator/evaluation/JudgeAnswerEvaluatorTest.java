package com.interviewpilot.orchestrator.evaluation;

import com.interviewpilot.orchestrator.judge.Judge;
import com.interviewpilot.orchestrator.judge.JudgeException;
import com.interviewpilot.orchestrator.model.PointStatus;
import com.interviewpilot.orchestrator.model.Question;
import com.interviewpilot.orchestrator.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JudgeAnswerEvaluatorTest {

    @Mock Judge judge;

    private final Question question = new Question("q1", "How do you cache?", List.of("redis", "ttl"));

    @Test
    void evaluate_explainedAndPresentPoints_noGap() {
        when(judge.evaluate("How do you cache?", "answer", List.of("redis", "ttl"))).thenReturn(
                new Verdict(Map.of("redis", PointStatus.EXPLAINED, "ttl", PointStatus.PRESENT), 9.0, null));

        Evaluation evaluation = new JudgeAnswerEvaluator(judge).evaluate(question, "answer");

        assertThat(evaluation.hasGap()).isFalse();
        assertThat(evaluation.verdict().overallScore()).isEqualTo(9.0);
    }

    @Test
    void evaluate_pointOmittedFromVerdict_countsAsMissing() {
        when(judge.evaluate("How do you cache?", "answer", List.of("redis", "ttl"))).thenReturn(
                new Verdict(Map.of("redis", PointStatus.PRESENT), 5.0, "  What about expiry?  "));

        Evaluation evaluation = new JudgeAnswerEvaluator(judge).evaluate(question, "answer");

        assertThat(evaluation.missing()).containsExactly("ttl");
        assertThat(evaluation.suggestedFollowUp()).isEqualTo("What about expiry?");
    }

    @Test
    void evaluate_blankSuggestion_isDropped() {
        when(judge.evaluate("How do you cache?", "answer", List.of("redis", "ttl"))).thenReturn(
                new Verdict(Map.of("redis", PointStatus.MISSING, "ttl", PointStatus.MISSING), 1.0, " "));

        Evaluation evaluation = new JudgeAnswerEvaluator(judge).evaluate(question, "answer");

        assertThat(evaluation.missing()).containsExactly("redis", "ttl");
        assertThat(evaluation.suggestedFollowUp()).isNull();
    }

    @Test
    void evaluate_judgeFails_propagates() {
        when(judge.evaluate("How do you cache?", "answer", List.of("redis", "ttl")))
                .thenThrow(new JudgeException(JudgeException.Kind.TIMEOUT, "slow"));

        assertThatThrownBy(() -> new JudgeAnswerEvaluator(judge).evaluate(question, "answer"))
                .isInstanceOf(JudgeException.class);
    }

    @Test
    void keywordEvaluator_scoresByCoveredShare() {
        Evaluation evaluation = new KeywordAnswerEvaluator().evaluate(question, "we use redis");

        assertThat(evaluation.missing()).containsExactly("ttl");
        assertThat(evaluation.suggestedFollowUp()).isNull();
        assertThat(evaluation.verdict().overallScore()).isEqualTo(5.0);
        assertThat(evaluation.verdict().perPointStatus())
                .containsEntry("redis", PointStatus.PRESENT)
                .containsEntry("ttl", PointStatus.MISSING);
    }
}
