package com.example.autoheal.risk;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Diagnosis oracle backed by an OpenAI-compatible chat completion endpoint.
 * Unavailable when no API key is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmDiagnosisOracle implements DiagnosisOracle {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private static final String SYSTEM_PROMPT =
            "You are an expert in infrastructure diagnostics and remediation.";

    private final AutohealProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    @Override
    public boolean isAvailable() {
        String key = properties.getDiagnosis().getApiKey();
        return key != null && !key.isBlank();
    }

    @Override
    public Diagnosis diagnose(Issue issue) {
        AutohealProperties.DiagnosisConfig config = properties.getDiagnosis();
        log.debug("Requesting diagnosis for {} from {}", issue.shortId(), config.getModel());
        try {
            Request request = new Request.Builder()
                    .url(config.getBaseUrl())
                    .addHeader("Authorization", "Bearer " + config.getApiKey())
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(buildRequestBody(issue), JSON))
                    .build();

            OkHttpClient clientWithTimeout = httpClient.newBuilder()
                    .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                    .build();

            try (Response response = clientWithTimeout.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw new DiagnosisException("Diagnosis API returned " + response.code());
                }
                String body = response.body() != null ? response.body().string() : "";
                return parse(extractContent(body));
            }
        } catch (IOException e) {
            throw new DiagnosisException("Diagnosis request failed: " + e.getMessage(), e);
        }
    }

    String buildPrompt(Issue issue) throws IOException {
        return """
                Analyze this infrastructure health issue and provide:
                1. Root cause analysis
                2. Recommended remediation action
                3. Risk level assessment (low/medium/high)

                Issue:
                - Component: %s
                - Type: %s
                - Severity: %s
                - Description: %s
                - Metrics: %s

                Respond in JSON format:
                {
                    "root_cause": "explanation",
                    "remediation": "specific action to take",
                    "risk_level": "low|medium|high",
                    "reasoning": "why this is the best approach"
                }""".formatted(
                issue.getComponent(),
                issue.getIssueType(),
                issue.getSeverity(),
                issue.getDescription(),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(issue.getMetrics()));
    }

    private String buildRequestBody(Issue issue) throws IOException {
        AutohealProperties.DiagnosisConfig config = properties.getDiagnosis();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());

        ArrayNode messages = root.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", SYSTEM_PROMPT);
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", buildPrompt(issue));

        return objectMapper.writeValueAsString(root);
    }

    private String extractContent(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new DiagnosisException("No choices in diagnosis response");
        }
        JsonNode message = choices.get(0).get("message");
        return message != null && message.hasNonNull("content") ? message.get("content").asText() : "";
    }

    /**
     * Pull the first JSON object out of free text. Missing or non-text fields come back null.
     */
    Diagnosis parse(String text) {
        Matcher matcher = JSON_OBJECT.matcher(text != null ? text : "");
        if (!matcher.find()) {
            throw new DiagnosisException("No JSON object in diagnosis response");
        }
        try {
            JsonNode node = objectMapper.readTree(matcher.group());
            return new Diagnosis(
                    textOrNull(node, "root_cause"),
                    textOrNull(node, "remediation"),
                    textOrNull(node, "risk_level"),
                    textOrNull(node, "reasoning"));
        } catch (IOException e) {
            throw new DiagnosisException("Malformed JSON in diagnosis response", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
