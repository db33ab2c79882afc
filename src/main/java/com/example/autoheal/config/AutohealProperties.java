package com.example.autoheal.config;

import com.example.autoheal.domain.RemediationAction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Central configuration for the remediation engine.
 * Maps to the 'autoheal' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "autoheal")
public class AutohealProperties {

    private RemediationConfig remediation = new RemediationConfig();
    private ApprovalConfig approval = new ApprovalConfig();
    private DiagnosisConfig diagnosis = new DiagnosisConfig();
    private AlertsConfig alerts = new AlertsConfig();
    private PredictionConfig prediction = new PredictionConfig();
    private HealthConfig health = new HealthConfig();
    private NotificationConfig notifications = new NotificationConfig();

    @Data
    public static class RemediationConfig {
        /** When true every action waits for a human, whatever its risk tier */
        private boolean requireApproval = false;
        private int maxActionsPerHour = 10;
        private int actionTimeoutSeconds = 120;
        /** Must stay longer than the longest cooldown window */
        private int historyRetentionHours = 168;
        /** Keyed by kebab-case action type, e.g. container-restart */
        private Map<String, Integer> cooldownMinutes = new HashMap<>();

        public int cooldownFor(RemediationAction.RemediationType type) {
            return cooldownMinutes.getOrDefault(type.configKey(), type.getDefaultCooldownMinutes());
        }
    }

    @Data
    public static class ApprovalConfig {
        private int defaultTtlMinutes = 60;
        /** Hard ceiling, requests never live longer than a day */
        private int maxTtlMinutes = 1440;
        private int sweepIntervalSeconds = 60;
    }

    @Data
    public static class DiagnosisConfig {
        private boolean enabled = true;
        private String provider = "openai";
        private String model = "gpt-4o-mini";
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1/chat/completions";
        private double temperature = 0.2;
        private int maxTokens = 1024;
        private int timeoutSeconds = 20;
    }

    @Data
    public static class AlertsConfig {
        private int resolvedRetentionHours = 24;
        private int defaultSilenceMinutes = 60;
    }

    @Data
    public static class PredictionConfig {
        private boolean enabled = true;
        private int intervalMinutes = 60;
        private int historyDays = 7;
        private int minDataPoints = 24;
        /** Turn high-signal forecasts into synthetic issues */
        private boolean spawnIssues = false;
    }

    @Data
    public static class HealthConfig {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        private boolean dockerEnabled = false;
        private boolean hostEnabled = true;
        /** Component name used for issues and samples of the local host */
        private String hostName = "localhost";
        private String diskPath = "/";
        private double diskWarnPercent = 85.0;
        private double diskCriticalPercent = 95.0;
        private double memoryWarnPercent = 90.0;
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();
        private int dedupWindowSeconds = 300;

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }
}
