package com.example.autoheal.remediation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Runs remediations on the local host through docker, systemctl, find and logrotate.
 * Commands are passed as argument vectors, never through a shell, and a target
 * outside {@link #TARGET_PATTERN} fails without spawning anything.
 */
@Slf4j
@Component
public class CommandLineActionCollaborator implements ActionCollaborator {

    static final Pattern TARGET_PATTERN = Pattern.compile("[A-Za-z0-9._:/-]+");

    @Override
    public ActionResult restartService(String target, Duration timeout) {
        if (!isValidTarget(target)) return rejected(target);
        return run(List.of("sudo", "systemctl", "restart", stripScope(target)), timeout);
    }

    @Override
    public ActionResult restartContainer(String target, Duration timeout) {
        if (!isValidTarget(target)) return rejected(target);
        return run(List.of("docker", "restart", stripScope(target)), timeout);
    }

    @Override
    public ActionResult cleanupDisk(String target, Duration timeout) {
        if (!isValidTarget(target)) return rejected(target);
        int sep = target.lastIndexOf(':');
        String path = sep >= 0 ? target.substring(sep + 1) : target;
        if (path.isBlank() || "/".equals(path) || !path.startsWith("/") || path.contains("..")) {
            return ActionResult.failure("Refusing to clean path '" + path + "'");
        }
        // keep the last 7 days
        return run(List.of("find", path, "-type", "f", "(", "-name", "*.log", "-o", "-name", "*.gz", ")",
                "-mtime", "+7", "-delete"), timeout);
    }

    @Override
    public ActionResult rotateLogs(String target, Duration timeout) {
        return run(List.of("sudo", "logrotate", "-f", "/etc/logrotate.conf"), timeout);
    }

    @Override
    public ActionResult scaleResource(String target, Duration timeout) {
        return ActionResult.failure("Resource scaling is not supported on this host: " + target);
    }

    @Override
    public ActionResult custom(String target, String instruction, Duration timeout) {
        return ActionResult.failure("No handler for custom action '" + instruction + "' on " + target);
    }

    static boolean isValidTarget(String target) {
        if (target == null || !TARGET_PATTERN.matcher(target).matches()) return false;
        String name = stripScope(target);
        return !name.isEmpty() && !name.startsWith("-");
    }

    private static ActionResult rejected(String target) {
        log.warn("Rejected remediation target {}", target == null ? null : target.replaceAll("\\p{Cntrl}", "?"));
        return ActionResult.failure("Invalid target: only letters, digits and ._:/- are allowed");
    }

    private ActionResult run(List<String> command, Duration timeout) {
        String display = String.join(" ", command);
        log.info("Executing: {}", display);
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            Process process = pb.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return ActionResult.failure("Timed out after " + timeout.toSeconds() + "s: " + display);
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return ActionResult.failure("Exit code " + exitCode + ": " + output);
            }
            return ActionResult.success(output.isEmpty() ? "OK" : output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.failure("Interrupted: " + display);
        } catch (Exception e) {
            return ActionResult.failure("Command failed: " + e.getMessage());
        }
    }

    private static String stripScope(String target) {
        int sep = target.indexOf(':');
        return sep >= 0 ? target.substring(sep + 1) : target;
    }
}
