package com.triage.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link LanguageModel} backed by the Anthropic Messages API.
 *
 * Each call is a single user turn with a system prompt. Rate-limit and
 * overload responses (429, 503, 529) are retried with exponential backoff;
 * every other non-200 status fails immediately.
 */
@Component
public class ClaudeClient implements LanguageModel {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Concatenated text of all text blocks. */
        public String text() {
            if (content == null || content.isEmpty()) {
                throw new IllegalStateException("No content in response");
            }
            StringBuilder sb = new StringBuilder();
            content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .forEach(b -> sb.append(b.text()));
            return sb.toString();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL     = "https://api.anthropic.com/v1/messages";
    private static final String API_VER     = "2023-06-01";
    private static final int    MAX_TOKENS  = 4096;
    private static final int    MAX_RETRIES = 3;

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final String        apiKey;
    private final String        model;
    private final long          backoffMillis;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${triage.llm.model}") String model,
                        @Value("${triage.llm.backoff-millis:1000}") long backoffMillis,
                        ObjectMapper objectMapper) {
        this.apiKey        = apiKey;
        this.model         = model;
        this.backoffMillis = backoffMillis;
        this.json          = objectMapper;
        this.http          = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String generate(String systemPrompt, String prompt) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     systemPrompt,
                    "messages",   List.of(new Message("user", prompt))
            ));
        } catch (Exception e) {
            throw new LanguageModelException("Failed to serialise Claude request", e);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                return send(requestBody);
            } catch (LanguageModelException e) {
                if (!e.isRetryable() || attempt >= MAX_RETRIES) throw e;
                long delay = backoffMillis * (1L << (attempt - 1));
                log.warn("Claude API returned {} (attempt {}/{}), retrying in {} ms",
                        e.statusCode(), attempt, MAX_RETRIES, delay);
                sleep(delay);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private String send(String requestBody) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new LanguageModelException(response.statusCode(),
                        "Claude API error %d: %s".formatted(response.statusCode(), response.body()));
            }
            return json.readValue(response.body(), MessagesResponse.class).text();

        } catch (LanguageModelException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageModelException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new LanguageModelException("Claude API call failed", e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageModelException("Interrupted while backing off", e);
        }
    }
}
