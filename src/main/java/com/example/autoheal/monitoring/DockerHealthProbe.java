package com.example.autoheal.monitoring;

import com.example.autoheal.alert.DetectedIssue;
import com.example.autoheal.domain.Issue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Flags exited and unhealthy containers through the docker CLI. A daemon that
 * does not answer is reported as daemon_unhealthy.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "autoheal.health", name = "docker-enabled", havingValue = "true")
public class DockerHealthProbe implements HealthProbe {

    static final String NAME = "docker";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DetectedIssue> probe() throws Exception {
        ProcessBuilder pb = new ProcessBuilder("docker", "ps", "-a", "--format", "{{.Names}}|{{.State}}|{{.Status}}");
        pb.redirectErrorStream(true);
        Process process = pb.start();
        if (!process.waitFor(30, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            return List.of(daemonIssue("docker ps timed out"));
        }
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        if (process.exitValue() != 0) {
            return List.of(daemonIssue(output));
        }
        return parse(output);
    }

    static List<DetectedIssue> parse(String output) {
        List<DetectedIssue> issues = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String[] parts = line.split("\\|", 3);
            if (parts.length < 3) continue;
            String name = parts[0].trim();
            String state = parts[1].trim().toLowerCase(Locale.ROOT);
            String status = parts[2].trim();

            if (state.equals("exited") || state.equals("dead")) {
                issues.add(new DetectedIssue(NAME, name, "container_stopped", Issue.Severity.WARNING,
                        "Docker container '" + name + "' exited: " + status,
                        Map.of("container", name, "state", state, "status", status),
                        "Restart container '" + name + "'"));
            } else if (status.toLowerCase(Locale.ROOT).contains("unhealthy")) {
                issues.add(new DetectedIssue(NAME, name, "container_unhealthy", Issue.Severity.WARNING,
                        "Docker container '" + name + "' is unhealthy",
                        Map.of("container", name, "status", status),
                        "Restart container '" + name + "'"));
            }
        }
        return issues;
    }

    private static DetectedIssue daemonIssue(String detail) {
        log.warn("Docker daemon check failed: {}", detail);
        return new DetectedIssue(NAME, "docker_daemon", "daemon_unhealthy", Issue.Severity.CRITICAL,
                "Docker daemon is not responding properly", Map.of("info", detail), "Restart Docker daemon");
    }
}
