package com.interviewpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpilot.orchestrator.engine.FollowUpPolicy;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JobConfigLoader: the bundled default config plus files written
 * to a temp directory.
 */
class JobConfigLoaderTest {

    @TempDir Path dir;

    private final JobConfigLoader loader = new JobConfigLoader(new ObjectMapper(), "classpath:job_config.json");

    @Test
    void loadDefault_bundledConfig_isValid() {
        InterviewConfig config = loader.loadDefault();

        assertThat(config.questionCount()).isEqualTo(3);
        assertThat(config.question(0).id()).isEqualTo("q1");
        assertThat(config.question(0).requiredKeywords()).containsExactly("redis", "ttl");
        assertThat(config.maxFollowupChances()).isEqualTo(2);
        assertThat(config.followUpPolicy()).isEqualTo(FollowUpPolicy.PER_QUESTION);
    }

    @Test
    void load_minimalFile_appliesDefaults() throws IOException {
        Path file = write("minimal.json", """
                {"questions": [{"id": "q1", "text": "Tell me about caching"}]}
                """);

        InterviewConfig config = loader.load("file:" + file);

        assertThat(config.jobDescription()).isEmpty();
        assertThat(config.maxFollowupChances()).isEqualTo(InterviewConfig.DEFAULT_MAX_FOLLOWUP_CHANCES);
        assertThat(config.followUpPolicy()).isNull();
        assertThat(config.question(0).requiredKeywords()).isEmpty();
        assertThat(config.question(0).guidance()).isEmpty();
    }

    @Test
    void load_perKeywordPolicy_acceptsHyphenatedName() throws IOException {
        Path file = write("policy.json", """
                {"follow_up_policy": "per-keyword",
                 "questions": [{"id": "q1", "text": "Caching?", "required_keywords": ["redis"]}]}
                """);

        assertThat(loader.load("file:" + file).followUpPolicy()).isEqualTo(FollowUpPolicy.PER_KEYWORD);
    }

    @Test
    void load_duplicateIdsAndBlankText_reportsEveryProblem() throws IOException {
        Path file = write("dupes.json", """
                {"max_followup_chances": -1,
                 "questions": [{"id": "q1", "text": "A?"}, {"id": "q1", "text": " "}]}
                """);

        assertThatThrownBy(() -> loader.load("file:" + file))
                .isInstanceOf(ConfigInvalidException.class)
                .satisfies(e -> assertThat(((ConfigInvalidException) e).getProblems()).containsExactly(
                        "duplicate question id 'q1'",
                        "questions[1].text is blank",
                        "max_followup_chances must be >= 0, was -1"));
    }

    @Test
    void load_noQuestions_invalid() throws IOException {
        Path file = write("empty.json", """
                {"job_description": "jd", "questions": []}
                """);

        assertThatThrownBy(() -> loader.load("file:" + file))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("at least one question is required");
    }

    @Test
    void load_missingFile_invalid() {
        assertThatThrownBy(() -> loader.load("file:" + dir.resolve("absent.json")))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_unparsableFile_invalid() throws IOException {
        Path file = write("broken.json", "{\"questions\": [");

        assertThatThrownBy(() -> loader.load("file:" + file))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("could not parse");
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
