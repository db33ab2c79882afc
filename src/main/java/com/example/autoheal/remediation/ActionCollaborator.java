package com.example.autoheal.remediation;

import java.time.Duration;

/**
 * The infrastructure side of remediation: one entry point per action type.
 * Implementations report failure through {@link ActionResult}; a thrown
 * exception is treated the same way by the executor.
 */
public interface ActionCollaborator {

    ActionResult restartService(String target, Duration timeout);

    ActionResult restartContainer(String target, Duration timeout);

    /** target is {@code host:path} */
    ActionResult cleanupDisk(String target, Duration timeout);

    ActionResult rotateLogs(String target, Duration timeout);

    ActionResult scaleResource(String target, Duration timeout);

    ActionResult custom(String target, String instruction, Duration timeout);
}
