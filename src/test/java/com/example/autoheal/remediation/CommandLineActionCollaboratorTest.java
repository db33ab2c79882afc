package com.example.autoheal.remediation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineActionCollaboratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final CommandLineActionCollaborator collaborator = new CommandLineActionCollaborator();

    @Test
    void injectedCommandInTargetIsRejectedWithoutRunning(@TempDir Path dir) {
        Path marker = dir.resolve("marker");

        ActionResult result = collaborator.restartContainer("container:nginx\ntouch " + marker, TIMEOUT);

        assertFalse(result.success());
        assertTrue(result.message().startsWith("Invalid target"));
        assertFalse(Files.exists(marker));
    }

    @Test
    void shellMetacharactersAreRejected() {
        for (String target : new String[]{"nginx > /tmp/out", "svc;reboot", "svc$(id)", "a|b", "name with space", "`x`"}) {
            assertFalse(collaborator.restartService(target, TIMEOUT).success(), target);
            assertFalse(CommandLineActionCollaborator.isValidTarget(target), target);
        }
    }

    @Test
    void optionLikeOrEmptyNamesAreRejected() {
        assertFalse(CommandLineActionCollaborator.isValidTarget("container:--help"));
        assertFalse(CommandLineActionCollaborator.isValidTarget("container:"));
        assertFalse(CommandLineActionCollaborator.isValidTarget(""));
        assertFalse(CommandLineActionCollaborator.isValidTarget(null));
    }

    @Test
    void plainNamesArePermitted() {
        assertTrue(CommandLineActionCollaborator.isValidTarget("container:nginx-proxy_1"));
        assertTrue(CommandLineActionCollaborator.isValidTarget("web-01.prod:9100"));
        assertTrue(CommandLineActionCollaborator.isValidTarget("db-ctl:/var/log"));
    }

    @Test
    void unsafeCleanupPathsAreRefused() {
        assertFalse(collaborator.cleanupDisk("host:/", TIMEOUT).success());
        assertFalse(collaborator.cleanupDisk("host:/var/../etc", TIMEOUT).success());
        assertFalse(collaborator.cleanupDisk("host:relative/dir", TIMEOUT).success());
    }
}
