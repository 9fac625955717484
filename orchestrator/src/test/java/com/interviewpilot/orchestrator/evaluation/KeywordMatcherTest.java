package com.interviewpilot.orchestrator.evaluation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for KeywordMatcher.
 *
 * Pure static functions, no mocks needed.
 */
class KeywordMatcherTest {

    // ------------------------------------------------------------------
    // missingKeywords()
    // ------------------------------------------------------------------

    @Test
    void missingKeywords_answerMentionsOneOfTwo_returnsTheOther() {
        List<String> missing = KeywordMatcher.missingKeywords(
                "I would put a Redis cache in front of the database", List.of("redis", "ttl"));

        assertThat(missing).containsExactly("ttl");
    }

    @Test
    void missingKeywords_allCovered_returnsEmpty() {
        List<String> missing = KeywordMatcher.missingKeywords(
                "Redis with a short TTL per key", List.of("redis", "ttl"));

        assertThat(missing).isEmpty();
    }

    @Test
    void missingKeywords_preservesRequiredOrder() {
        List<String> missing = KeywordMatcher.missingKeywords(
                "nothing relevant", List.of("tracing", "metrics", "logs"));

        assertThat(missing).containsExactly("tracing", "metrics", "logs");
    }

    @Test
    void missingKeywords_nullAnswer_treatedAsEmpty() {
        assertThat(KeywordMatcher.missingKeywords(null, List.of("redis"))).containsExactly("redis");
    }

    @Test
    void missingKeywords_noRequiredKeywords_returnsEmpty() {
        assertThat(KeywordMatcher.missingKeywords("anything", List.of())).isEmpty();
        assertThat(KeywordMatcher.missingKeywords("anything", null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // matches()
    // ------------------------------------------------------------------

    @Test
    void matches_isCaseInsensitive() {
        assertThat(KeywordMatcher.matches("We used REDIS heavily", "redis")).isTrue();
        assertThat(KeywordMatcher.matches("we used redis heavily", "Redis")).isTrue();
    }

    @Test
    void matches_requiresWholeTokens() {
        assertThat(KeywordMatcher.matches("the data was categorized", "cat")).isFalse();
        assertThat(KeywordMatcher.matches("a cat sat", "cat")).isTrue();
        assertThat(KeywordMatcher.matches("cat.", "cat")).isTrue();
    }

    @Test
    void matches_multiWordKeyword_acceptsAnySeparatorRun() {
        assertThat(KeywordMatcher.matches("a Redis-cache layer", "redis cache")).isTrue();
        assertThat(KeywordMatcher.matches("a redis_cache layer", "redis cache")).isTrue();
        assertThat(KeywordMatcher.matches("a REDIS / cache layer", "redis cache")).isTrue();
        assertThat(KeywordMatcher.matches("redis   cache", "redis-cache")).isTrue();
    }

    @Test
    void matches_multiWordKeyword_tokensMustBeAdjacent() {
        assertThat(KeywordMatcher.matches("redis is a cache", "redis cache")).isFalse();
    }

    @Test
    void matches_regexCharactersInKeyword_areLiteral() {
        assertThat(KeywordMatcher.matches("we wrote it in c++ originally", "c++")).isTrue();
        assertThat(KeywordMatcher.matches("node.js services", "node.js")).isTrue();
        assertThat(KeywordMatcher.matches("nodeXjs services", "node.js")).isFalse();
    }

    @Test
    void matches_blankKeyword_isSatisfied() {
        assertThat(KeywordMatcher.matches("anything", "  ")).isTrue();
        assertThat(KeywordMatcher.matches("anything", null)).isTrue();
    }

    @Test
    void matches_unicodeLetters_areTokenCharacters() {
        assertThat(KeywordMatcher.matches("Kündigung", "kündigung")).isTrue();
        assertThat(KeywordMatcher.matches("Kündigungsfrist", "kündigung")).isFalse();
    }
}
