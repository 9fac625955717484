package com.interviewpilot.orchestrator.judge;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseParser.
 *
 * Pure utility class, so no Spring context and no mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractFencedBlock
    // ------------------------------------------------------------------

    @Test
    void extractFencedBlock_withJsonFence_returnsContent() {
        String response = """
                Here is my verdict.
                ```json
                {"points": {"redis": "present"}, "score": 6}
                ```
                """;
        Optional<String> block = ResponseParser.extractFencedBlock(response);
        assertThat(block).contains("{\"points\": {\"redis\": \"present\"}, \"score\": 6}");
    }

    @Test
    void extractFencedBlock_withUnlabelledFence_returnsContent() {
        String response = """
                ```
                {"score": 1}
                ```
                """;
        assertThat(ResponseParser.extractFencedBlock(response)).contains("{\"score\": 1}");
    }

    @Test
    void extractFencedBlock_noFence_returnsEmpty() {
        assertThat(ResponseParser.extractFencedBlock("{\"score\": 1}")).isEmpty();
        assertThat(ResponseParser.extractFencedBlock(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractJsonObject
    // ------------------------------------------------------------------

    @Test
    void extractJsonObject_bareJson_returnsIt() {
        assertThat(ResponseParser.extractJsonObject("{\"score\": 3}")).contains("{\"score\": 3}");
    }

    @Test
    void extractJsonObject_jsonInsideProse_returnsOutermostBraces() {
        String response = "Verdict: {\"points\": {\"ttl\": \"missing\"}, \"score\": 2} Hope this helps.";
        assertThat(ResponseParser.extractJsonObject(response))
                .contains("{\"points\": {\"ttl\": \"missing\"}, \"score\": 2}");
    }

    @Test
    void extractJsonObject_prefersFencedBlock() {
        String response = """
                Ignore {this}.
                ```json
                {"score": 9}
                ```
                """;
        assertThat(ResponseParser.extractJsonObject(response)).contains("{\"score\": 9}");
    }

    @Test
    void extractJsonObject_noBraces_returnsEmpty() {
        assertThat(ResponseParser.extractJsonObject("I cannot evaluate this answer.")).isEmpty();
        assertThat(ResponseParser.extractJsonObject("  ")).isEmpty();
    }
}
