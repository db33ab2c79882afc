package com.example.autoheal.notification;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Default notification channel. Posts to a Slack incoming webhook when one is
 * configured and logs otherwise. Identical messages inside the dedup window
 * are dropped.
 */
@Slf4j
@Service
public class NotificationService implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json");

    private final AutohealProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Cache<String, Boolean> recentMessages;

    public NotificationService(AutohealProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.recentMessages = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, properties.getNotifications().getDedupWindowSeconds())))
                .maximumSize(10_000)
                .build();
    }

    @Async("backgroundExecutor")
    @Override
    public void notify(String text) {
        if (recentMessages.asMap().putIfAbsent(text, Boolean.TRUE) != null) {
            log.debug("Suppressed duplicate notification: {}", text);
            return;
        }
        send(text);
    }

    @Async("backgroundExecutor")
    @Override
    public void requestApproval(Issue issue, String approvalId) {
        String shortId = approvalId.length() > 8 ? approvalId.substring(0, 8) : approvalId;
        String text = String.format(
                ":warning: *Approval needed* `%s`%n*%s* on %s (risk: %s, severity: %s)%n%s%nSuggested fix: %s%n"
                        + "Reply with `approve %s` or `reject %s`",
                shortId, issue.getName(), issue.getComponent(), issue.getRiskLevel(), issue.getSeverity(),
                issue.getDescription(), issue.getSuggestedFix(), shortId, shortId);
        send(text);
    }

    private void send(String text) {
        AutohealProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        if (!slack.isEnabled()) {
            log.info("Notification: {}", text);
            return;
        }
        String webhookUrl = slack.getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            log.warn("Slack webhook URL not configured");
            return;
        }

        try {
            Map<String, Object> payload = Map.of(
                    "text", text,
                    "username", "Autoheal",
                    "icon_emoji", ":robot_face:"
            );
            Request request = new Request.Builder()
                    .url(webhookUrl)
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.debug("Slack notification sent");
                } else {
                    log.error("Slack notification failed: {}", response.code());
                }
            }
        } catch (IOException e) {
            log.error("Failed to send Slack notification: {}", e.getMessage());
        }
    }
}
