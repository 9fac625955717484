package com.interviewpilot.orchestrator.judge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpilot.orchestrator.model.AnsweredRecord;
import com.interviewpilot.orchestrator.model.PointStatus;
import com.interviewpilot.orchestrator.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Judge} backed by the Anthropic Messages API.
 *
 * Raw {@link HttpClient} rather than an SDK: the API is a single REST
 * endpoint and we want full control over timeouts and error mapping.
 *
 * Error mapping:
 * <ul>
 *   <li>no API key, non-200 status, I/O failure → UNAVAILABLE</li>
 *   <li>HTTP request timeout                    → TIMEOUT</li>
 *   <li>reply is not the expected JSON verdict  → MALFORMED_RESPONSE</li>
 * </ul>
 */
@Component
public class ClaudeJudge implements Judge {

    private static final Logger log = LoggerFactory.getLogger(ClaudeJudge.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** A single message in a conversation; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    /** Wire shape of the verdict JSON the evaluation prompt asks for. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerdictPayload(
            @JsonProperty("points")    Map<String, String> points,
            @JsonProperty("score")     Double              score,
            @JsonProperty("follow_up") String              followUp) {}

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 1024;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final Duration     requestTimeout;
    private final String       apiUrl;

    public ClaudeJudge(@Value("${anthropic.api-key:}") String apiKey,
                       @Value("${interview.judge.model:claude-sonnet-4-6}") String model,
                       @Value("${interview.judge.timeout:30s}") Duration requestTimeout,
                       ObjectMapper objectMapper) {
        this(apiKey, model, requestTimeout, objectMapper, API_URL);
    }

    ClaudeJudge(String apiKey, String model, Duration requestTimeout,
                ObjectMapper objectMapper, String apiUrl) {
        this.apiKey         = apiKey;
        this.model          = model;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.apiUrl         = apiUrl;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Judge
    // -------------------------------------------------------------------------

    @Override
    public Verdict evaluate(String question, String answer, List<String> expectedPoints) {
        String reply = complete(JudgePrompts.EVALUATE_SYSTEM,
                JudgePrompts.evaluateUser(question, answer, expectedPoints));
        return parseVerdict(reply);
    }

    @Override
    public String summarize(String jobDescription, List<AnsweredRecord> answers) {
        String reply = complete(JudgePrompts.SUMMARIZE_SYSTEM,
                JudgePrompts.summarizeUser(jobDescription, answers));
        if (reply == null || reply.isBlank()) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE, "empty summary");
        }
        return reply.strip();
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    /**
     * Parse the judge's reply into a {@link Verdict}.
     * Package-private so the JSON contract can be tested without HTTP.
     */
    Verdict parseVerdict(String reply) {
        String body = ResponseParser.extractJsonObject(reply).orElseThrow(() ->
                new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                        "no JSON object in judge reply"));
        VerdictPayload payload;
        try {
            payload = json.readValue(body, VerdictPayload.class);
        } catch (JsonProcessingException e) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                    "judge reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (payload.points() == null || payload.score() == null) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                    "judge reply lacks 'points' or 'score'");
        }

        Map<String, PointStatus> statuses = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : payload.points().entrySet()) {
            PointStatus status = PointStatus.fromWire(e.getValue());
            if (status == null) {
                throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                        "unknown status '" + e.getValue() + "' for point '" + e.getKey() + "'");
            }
            statuses.put(e.getKey(), status);
        }
        double score = Math.max(0.0, Math.min(Verdict.MAX_SCORE, payload.score()));
        return new Verdict(statuses, score, payload.followUp());
    }

    // -------------------------------------------------------------------------
    // HTTP
    // -------------------------------------------------------------------------

    private String complete(String system, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new JudgeException(JudgeException.Kind.UNAVAILABLE, "no Anthropic API key configured");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     system,
                    "messages",   List.of(new Message("user", userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Judge call failed with HTTP {}", response.statusCode());
                throw new JudgeException(JudgeException.Kind.UNAVAILABLE,
                        "Anthropic API error %d: %s".formatted(response.statusCode(), response.body()));
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return parsed.firstText();

        } catch (JudgeException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new JudgeException(JudgeException.Kind.TIMEOUT,
                    "judge did not answer within " + requestTimeout, e);
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                    "unexpected Messages API response: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JudgeException(JudgeException.Kind.UNAVAILABLE, "judge call interrupted", e);
        } catch (IOException e) {
            throw new JudgeException(JudgeException.Kind.UNAVAILABLE, "judge call failed: " + e.getMessage(), e);
        }
    }
}
