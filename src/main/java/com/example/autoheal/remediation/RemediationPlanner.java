package com.example.autoheal.remediation;

import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction.RemediationType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Picks the remediation for an issue type. Alerts may override the choice
 * with {@code autoheal_action} and {@code autoheal_target} annotations.
 */
@Component
public class RemediationPlanner {

    static final String ACTION_ANNOTATION = "autoheal_action";
    static final String TARGET_ANNOTATION = "autoheal_target";
    static final String DEFAULT_CLEANUP_PATH = "/var/log";

    public Optional<RemediationPlan> plan(Issue issue) {
        Optional<RemediationPlan> annotated = fromAnnotations(issue);
        if (annotated.isPresent()) return annotated;

        String type = issue.getIssueType() != null ? issue.getIssueType() : "";
        String component = issue.getComponent();
        return switch (type) {
            case "container_stopped", "container_unhealthy" -> {
                String container = containerName(issue);
                yield Optional.of(new RemediationPlan(RemediationType.CONTAINER_RESTART,
                        "container:" + container, "Restart container " + container));
            }
            case "service_stopped" -> Optional.of(new RemediationPlan(RemediationType.SERVICE_RESTART,
                    "service:" + component, "Restart service " + component));
            case "daemon_unhealthy" -> Optional.of(new RemediationPlan(RemediationType.SERVICE_RESTART,
                    "service:docker", "Restart the docker daemon"));
            case "high_disk", "disk_full", "predicted_disk_full" -> {
                String path = stringMetric(issue, "path", DEFAULT_CLEANUP_PATH);
                yield Optional.of(new RemediationPlan(RemediationType.DISK_CLEANUP,
                        component + ":" + path, "Clean up " + path + " on " + component));
            }
            case "log_volume" -> Optional.of(new RemediationPlan(RemediationType.LOG_ROTATION,
                    "logs:" + component, "Rotate logs on " + component));
            case "high_memory", "predicted_memory_exhaustion" -> Optional.of(new RemediationPlan(
                    RemediationType.RESOURCE_SCALE, "scale:" + component, "Scale memory for " + component));
            default -> Optional.empty();
        };
    }

    private Optional<RemediationPlan> fromAnnotations(Issue issue) {
        String action = issue.getAnnotations().get(ACTION_ANNOTATION);
        if (action == null || action.isBlank()) return Optional.empty();
        RemediationType type;
        try {
            type = RemediationType.valueOf(action.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            type = RemediationType.CUSTOM;
        }
        String target = issue.getAnnotations().getOrDefault(TARGET_ANNOTATION, issue.getComponent());
        String description = type == RemediationType.CUSTOM ? action.trim() : type.value() + " on " + target;
        return Optional.of(new RemediationPlan(type, target, description));
    }

    private static String containerName(Issue issue) {
        String fromMetrics = stringMetric(issue, "container", null);
        if (fromMetrics != null) return fromMetrics;
        String fromLabels = issue.getLabels().get("container");
        if (fromLabels == null) fromLabels = issue.getLabels().get("name");
        return fromLabels != null && !fromLabels.isBlank() ? fromLabels : issue.getComponent();
    }

    private static String stringMetric(Issue issue, String key, String fallback) {
        Object value = issue.getMetrics().get(key);
        if (value != null && !value.toString().isBlank()) return value.toString();
        String label = issue.getLabels().get(key);
        return label != null && !label.isBlank() ? label : fallback;
    }
}
