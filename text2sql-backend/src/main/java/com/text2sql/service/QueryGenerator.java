package com.text2sql.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Sends generation prompts to an OpenAI-compatible chat completion API.
 *
 * Requests go out over plain HTTP (no vendor SDK), so any gateway speaking the
 * {@code /v1/chat/completions} protocol can be configured. Exactly one request per call; failures
 * are not retried.
 */
@Service
public class QueryGenerator {

    private static final Logger log = LoggerFactory.getLogger(QueryGenerator.class);

    static final String DEFAULT_BASE_URL = "https://api.groq.com/openai";
    static final String DEFAULT_MODEL = "llama-3.1-8b-instant";
    private static final int DEFAULT_TIMEOUT_MS = 30000;
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;

    /**
     * Create a new query generator.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     */
    public QueryGenerator(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether the completion API is configured.
     *
     * The API key itself is never logged.
     */
    @PostConstruct
    public void logCompletionConfigStatus() {
        CompletionConfig config = CompletionConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("SQL generation is ENABLED (base_url={}, model={}, timeout_ms={})",
                    config.baseUrl(), config.model(), config.timeoutMs());
            return;
        }
        log.warn("SQL generation is DISABLED (base_url={}, model={}, api_key_configured=false); "
                + "set text2sql.ai.api-key or GROQ_API_KEY", config.baseUrl(), config.model());
    }

    /**
     * Ask the model for SQL.
     *
     * @param prompt prompt built by {@link PromptBuilder}
     * @return assistant message content, trimmed
     * @throws ExternalServiceException if the API is not configured or the call fails
     */
    public String generate(String prompt) {
        CompletionConfig config = CompletionConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new ExternalServiceException("Completion API is not configured: missing API key");
        }

        HttpResponse<String> response;
        try {
            Map<String, Object> payload = Map.of(
                    "model", config.model(),
                    "messages", List.of(Map.of(
                            "role", "system",
                            "content", prompt != null ? prompt : ""
                    ))
            );
            String json = objectMapper.writeValueAsString(payload);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + config.apiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            long startTime = System.currentTimeMillis();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("Completion API responded (status_code={}, duration_ms={})",
                    response.statusCode(), System.currentTimeMillis() - startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Completion API call interrupted", e);
        } catch (IOException e) {
            log.warn("Completion API request failed (base_url={}, model={}, error={})",
                    config.baseUrl(), config.model(), e.toString());
            throw new ExternalServiceException("Completion API call failed: " + e.getMessage(), e);
        }

        if (response.statusCode() >= 400) {
            log.warn("Completion API returned an error (status_code={}, base_url={}, model={})",
                    response.statusCode(), config.baseUrl(), config.model());
            throw new ExternalServiceException("Completion API error: HTTP " + response.statusCode()
                    + " - " + abbreviate(response.body()));
        }

        return extractContent(response.body());
    }

    private String extractContent(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ExternalServiceException("Completion API returned invalid JSON: " + e.getMessage(), e);
        }
        JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
        if (!contentNode.isTextual()) {
            throw new ExternalServiceException("Completion API returned no message content");
        }
        return contentNode.asText().trim();
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_ERROR_BODY_CHARS ? s : s.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }

    /**
     * Completion API settings resolved from properties, falling back to environment variables.
     */
    record CompletionConfig(
            String baseUrl,
            String apiKey,
            String model,
            int timeoutMs
    ) {
        static CompletionConfig fromEnvironment(Environment environment) {
            String baseUrl = getTrimmed(environment, "text2sql.ai.base-url", "TEXT2SQL_AI_BASE_URL");
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = DEFAULT_BASE_URL;
            }
            while (baseUrl.endsWith("/")) {
                baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
            }

            String apiKey = getTrimmed(environment, "text2sql.ai.api-key", "GROQ_API_KEY");

            String model = getTrimmed(environment, "text2sql.ai.model", "TEXT2SQL_AI_MODEL");
            if (model == null || model.isBlank()) {
                model = DEFAULT_MODEL;
            }

            int timeoutMs = DEFAULT_TIMEOUT_MS;
            String timeoutRaw = getTrimmed(environment, "text2sql.ai.timeout-ms", "TEXT2SQL_AI_TIMEOUT_MS");
            if (timeoutRaw != null && !timeoutRaw.isBlank()) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid completion timeout (timeout_ms={})", timeoutRaw);
                }
            }
            if (timeoutMs <= 0) {
                timeoutMs = DEFAULT_TIMEOUT_MS;
            }

            return new CompletionConfig(baseUrl, apiKey, model, timeoutMs);
        }

        boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        private static String getTrimmed(Environment environment, String propKey, String envKey) {
            if (environment == null) {
                return null;
            }
            String v = environment.getProperty(propKey);
            if (v == null || v.isBlank()) {
                v = environment.getProperty(envKey);
            }
            return v != null ? v.trim() : null;
        }
    }
}
