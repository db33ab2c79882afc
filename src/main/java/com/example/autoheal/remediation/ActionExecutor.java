package com.example.autoheal.remediation;

import com.example.autoheal.config.AutohealProperties;
import com.example.autoheal.domain.Issue;
import com.example.autoheal.domain.RemediationAction;
import com.example.autoheal.repository.RemediationActionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs an admitted action exactly once. Any failure, thrown or reported, is
 * terminal for the action; a retry is a new action through the gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionExecutor {

    private final ActionCollaborator collaborator;
    private final RemediationActionRepository actionRepository;
    private final AutohealProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public RemediationAction execute(RemediationAction action, Issue issue) {
        if (action.getStatus() != RemediationAction.ActionStatus.IN_PROGRESS) {
            throw new IllegalStateException("Action " + action.getActionId() + " is " + action.getStatus()
                    + ", only admitted actions can run");
        }
        Duration timeout = Duration.ofSeconds(properties.getRemediation().getActionTimeoutSeconds());
        Timer.Sample sample = Timer.start(meterRegistry);

        ActionResult result;
        try {
            result = dispatch(action, issue, timeout);
            if (result == null) {
                result = ActionResult.failure("Collaborator returned no result");
            }
        } catch (Exception e) {
            log.error("Action {} ({} on {}) threw: {}", action.getActionId(), action.getActionType().value(),
                    action.getTarget(), e.getMessage());
            result = ActionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        action.complete(result.success(), result.message(), clock.instant());
        RemediationAction saved = actionRepository.save(action);

        sample.stop(Timer.builder("autoheal.action.duration")
                .tag("type", action.getActionType().value())
                .tag("success", String.valueOf(result.success()))
                .register(meterRegistry));
        meterRegistry.counter("autoheal.actions",
                "type", action.getActionType().value(),
                "status", saved.getStatus().name()).increment();

        if (result.success()) {
            log.info("Action {} succeeded: {} on {}", action.getActionId(), action.getActionType().value(), action.getTarget());
        } else {
            log.error("Action {} failed: {} on {}: {}", action.getActionId(), action.getActionType().value(),
                    action.getTarget(), result.message());
        }
        return saved;
    }

    private ActionResult dispatch(RemediationAction action, Issue issue, Duration timeout) {
        String target = action.getTarget();
        return switch (action.getActionType()) {
            case SERVICE_RESTART -> collaborator.restartService(target, timeout);
            case CONTAINER_RESTART -> collaborator.restartContainer(target, timeout);
            case DISK_CLEANUP -> collaborator.cleanupDisk(target, timeout);
            case LOG_ROTATION -> collaborator.rotateLogs(target, timeout);
            case RESOURCE_SCALE -> collaborator.scaleResource(target, timeout);
            case CUSTOM -> collaborator.custom(target,
                    action.getDescription() != null ? action.getDescription() : issue.getSuggestedFix(), timeout);
        };
    }
}
