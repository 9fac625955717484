package com.interviewpilot.orchestrator.judge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpilot.orchestrator.model.PointStatus;
import com.interviewpilot.orchestrator.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the judge's verdict contract and its failure mapping.
 * No network: parsing is tested directly, and HTTP failures use an
 * unreachable local endpoint.
 */
class ClaudeJudgeTest {

    private final ClaudeJudge judge = new ClaudeJudge("test-key", "claude-sonnet-4-6",
            Duration.ofSeconds(2), new ObjectMapper(), "http://127.0.0.1:9/v1/messages");

    // ------------------------------------------------------------------
    // parseVerdict
    // ------------------------------------------------------------------

    @Test
    void parseVerdict_fencedJson_parsesPointsScoreAndFollowUp() {
        Verdict verdict = judge.parseVerdict("""
                ```json
                {"points": {"redis": "explained", "ttl": "missing"},
                 "score": 6.5,
                 "follow_up": "How would you expire stale entries?"}
                ```
                """);

        assertThat(verdict.perPointStatus())
                .containsEntry("redis", PointStatus.EXPLAINED)
                .containsEntry("ttl", PointStatus.MISSING);
        assertThat(verdict.overallScore()).isEqualTo(6.5);
        assertThat(verdict.followUp()).isEqualTo("How would you expire stale entries?");
        assertThat(verdict.missingPoints(List.of("redis", "ttl"))).containsExactly("ttl");
    }

    @Test
    void parseVerdict_scoreOutOfRange_isClamped() {
        assertThat(judge.parseVerdict("{\"points\": {}, \"score\": 14}").overallScore()).isEqualTo(10.0);
        assertThat(judge.parseVerdict("{\"points\": {}, \"score\": -2}").overallScore()).isEqualTo(0.0);
    }

    @Test
    void parseVerdict_noJson_malformed() {
        assertThatThrownBy(() -> judge.parseVerdict("The candidate did fine."))
                .isInstanceOf(JudgeException.class)
                .satisfies(e -> assertThat(((JudgeException) e).getKind())
                        .isEqualTo(JudgeException.Kind.MALFORMED_RESPONSE));
    }

    @Test
    void parseVerdict_missingScore_malformed() {
        assertThatThrownBy(() -> judge.parseVerdict("{\"points\": {\"redis\": \"present\"}}"))
                .isInstanceOf(JudgeException.class)
                .hasMessageContaining("score");
    }

    @Test
    void parseVerdict_unknownStatus_malformed() {
        assertThatThrownBy(() -> judge.parseVerdict("{\"points\": {\"redis\": \"sort of\"}, \"score\": 5}"))
                .isInstanceOf(JudgeException.class)
                .hasMessageContaining("sort of");
    }

    @Test
    void parseVerdict_invalidJson_malformed() {
        assertThatThrownBy(() -> judge.parseVerdict("{\"points\": {\"redis\": }"))
                .isInstanceOf(JudgeException.class)
                .satisfies(e -> assertThat(((JudgeException) e).getKind())
                        .isEqualTo(JudgeException.Kind.MALFORMED_RESPONSE));
    }

    // ------------------------------------------------------------------
    // HTTP failure mapping
    // ------------------------------------------------------------------

    @Test
    void evaluate_noApiKey_unavailable() {
        ClaudeJudge keyless = new ClaudeJudge("", "claude-sonnet-4-6", Duration.ofSeconds(2), new ObjectMapper());

        assertThatThrownBy(() -> keyless.evaluate("q", "a", List.of("redis")))
                .isInstanceOf(JudgeException.class)
                .satisfies(e -> assertThat(((JudgeException) e).getKind())
                        .isEqualTo(JudgeException.Kind.UNAVAILABLE));
    }

    @Test
    void summarize_endpointUnreachable_unavailable() {
        assertThatThrownBy(() -> judge.summarize("jd", List.of()))
                .isInstanceOf(JudgeException.class)
                .satisfies(e -> assertThat(((JudgeException) e).getKind())
                        .isEqualTo(JudgeException.Kind.UNAVAILABLE));
    }
}
