package com.taskpilot.orchestrator.runtime;

import java.util.UUID;

/**
 * Whether the output view for a task can be opened, and from which source.
 *
 * canOpenOutput is true for LIVE and BACKFILL, and for WAITING only while the
 * runtime reports the task as running.
 */
public record AutoOutputReadiness(
        AutoOutputMode mode,
        boolean        canOpenOutput,
        UUID           executionId,
        AgentHandle    runningAgent,
        boolean        isRunning,
        String         message
) {
    public static AutoOutputReadiness of(AutoOutputMode mode, UUID executionId,
                                         AgentHandle runningAgent, boolean isRunning,
                                         String message) {
        boolean canOpen = mode == AutoOutputMode.LIVE
                       || mode == AutoOutputMode.BACKFILL
                       || (mode == AutoOutputMode.WAITING && isRunning);
        return new AutoOutputReadiness(mode, canOpen, executionId, runningAgent, isRunning, message);
    }

    public static AutoOutputReadiness unavailable(String message) {
        return of(AutoOutputMode.UNAVAILABLE, null, null, false, message);
    }
}
