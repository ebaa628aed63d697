package com.taskpilot.orchestrator.runtime;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only snapshot of a task's runtime state.
 *
 * Snapshots are handed out by {@link RuntimeRegistry#get}; mutating the
 * registry afterwards does not change a snapshot already returned.
 */
public record RuntimeTaskView(
        UUID             taskId,
        RuntimeTaskPhase phase,
        UUID             executionId,
        int              runCount,
        AgentHandle      runningAgent,
        AgentHandle      reviewAgent,
        String           blockedReason,
        List<UUID>       blockedByTaskIds,
        List<String>     overlapHints,
        Instant          blockedAt,
        String           pendingReason,
        Instant          pendingAt
) {
    public boolean isRunning()   { return phase != RuntimeTaskPhase.IDLE; }
    public boolean isReviewing() { return phase == RuntimeTaskPhase.REVIEWING; }
    public boolean isBlocked()   { return blockedReason != null; }
    public boolean isPending()   { return pendingReason != null; }

    public boolean hasLiveAgent() { return runningAgent != null || reviewAgent != null; }
}
