package com.taskpilot.orchestrator.runtime;

import com.taskpilot.orchestrator.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory source of truth for "is this task's agent live right now".
 *
 * Holds one entry per task with non-idle state. Entries are created lazily by
 * the first transition call and evicted as soon as they carry nothing but
 * defaults, so {@link #get} returning empty means "idle, not blocked, not
 * pending".
 *
 * <p>All mutation goes through the methods below. Callers only ever see
 * {@link RuntimeTaskView} snapshots.
 *
 * <p>Transitions:
 * <pre>
 *   markStarted / attachRunningAgent → RUNNING
 *   attachReviewAgent                → REVIEWING (running agent kept)
 *   clearReviewAgent                 → RUNNING if a running agent is still attached
 *   markBlocked                      → IDLE, agents cleared, pending cleared
 *   markPending                      → IDLE unless currently running
 *   clearBlocked / clearPending      → evicts the entry if nothing is left
 *   markEnded                        → evicts unconditionally
 * </pre>
 */
@Component
public class RuntimeRegistry {

    private static final Logger log = LoggerFactory.getLogger(RuntimeRegistry.class);

    private final Map<UUID, Entry> entries = new HashMap<>();
    private final ExecutionRepository executions;
    private final Clock clock;

    public RuntimeRegistry(ExecutionRepository executions) {
        this(executions, Clock.systemUTC());
    }

    RuntimeRegistry(ExecutionRepository executions, Clock clock) {
        this.executions = executions;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public synchronized Optional<RuntimeTaskView> get(UUID taskId) {
        Entry e = entries.get(taskId);
        return e == null ? Optional.empty() : Optional.of(e.snapshot());
    }

    /** Ids of tasks whose phase is not IDLE. */
    public synchronized Set<UUID> runningTasks() {
        return entries.values().stream()
                .filter(e -> e.phase != RuntimeTaskPhase.IDLE)
                .map(e -> e.taskId)
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Snapshot of every tracked task. Used by tests and diagnostics. */
    public synchronized Map<UUID, RuntimeTaskView> snapshotAll() {
        return entries.values().stream()
                .collect(Collectors.toUnmodifiableMap(e -> e.taskId, Entry::snapshot));
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public synchronized void markStarted(UUID taskId) {
        Entry e = getOrCreate(taskId);
        e.phase = RuntimeTaskPhase.RUNNING;
        e.clearBlocked();
        e.clearPending();
    }

    public synchronized void setExecution(UUID taskId, UUID executionId, int runCount) {
        Entry e = getOrCreate(taskId);
        e.executionId = executionId;
        e.runCount    = runCount;
    }

    public synchronized void attachRunningAgent(UUID taskId, AgentHandle agent) {
        Entry e = getOrCreate(taskId);
        e.runningAgent = agent;
        if (e.phase == RuntimeTaskPhase.IDLE) {
            e.phase = RuntimeTaskPhase.RUNNING;
        }
        e.clearBlocked();
        e.clearPending();
    }

    public synchronized void attachReviewAgent(UUID taskId, AgentHandle agent) {
        Entry e = getOrCreate(taskId);
        e.reviewAgent = agent;
        e.phase = RuntimeTaskPhase.REVIEWING;
        e.clearBlocked();
        e.clearPending();
    }

    public synchronized void clearReviewAgent(UUID taskId) {
        Entry e = entries.get(taskId);
        if (e == null) return;
        e.reviewAgent = null;
        if (e.runningAgent != null) {
            e.phase = RuntimeTaskPhase.RUNNING;
        }
    }

    /**
     * Park a task that cannot run yet. A blocked task is never considered
     * live, so both agent handles are dropped.
     */
    public synchronized void markBlocked(UUID taskId, String reason,
                                         List<UUID> blockedByTaskIds,
                                         List<String> overlapHints) {
        Entry e = getOrCreate(taskId);
        e.phase            = RuntimeTaskPhase.IDLE;
        e.runningAgent     = null;
        e.reviewAgent      = null;
        e.blockedReason    = reason;
        e.blockedByTaskIds = blockedByTaskIds == null ? List.of() : List.copyOf(blockedByTaskIds);
        e.overlapHints     = overlapHints == null ? List.of() : List.copyOf(overlapHints);
        e.blockedAt        = clock.instant();
        e.clearPending();
    }

    public synchronized void markPending(UUID taskId, String reason) {
        Entry e = getOrCreate(taskId);
        e.pendingReason = reason;
        e.pendingAt     = clock.instant();
    }

    public synchronized void clearPending(UUID taskId) {
        Entry e = entries.get(taskId);
        if (e == null) return;
        e.clearPending();
        evictIfIdle(e);
    }

    public synchronized void clearBlocked(UUID taskId) {
        Entry e = entries.get(taskId);
        if (e == null) return;
        e.clearBlocked();
        evictIfIdle(e);
    }

    public synchronized void markEnded(UUID taskId) {
        entries.remove(taskId);
    }

    // ------------------------------------------------------------------
    // Reconciliation with persisted executions
    // ------------------------------------------------------------------

    /**
     * Bring in-memory state for the given tasks in line with the executions
     * table.
     *
     * A task with a persisted RUNNING execution gets a RUNNING entry (this is
     * how state survives a host restart). A RUNNING entry whose execution is
     * no longer RUNNING in the DB is evicted, unless it still carries an agent
     * handle or a blocked/pending reason.
     *
     * Running this twice against unchanged DB state leaves the same entries.
     * A DB error skips the cycle.
     */
    public void reconcileRunningTasks(Collection<UUID> taskIds) {
        Set<UUID> unique = new LinkedHashSet<>(taskIds);
        if (unique.isEmpty()) return;

        Map<UUID, UUID> latestRunning;
        try {
            latestRunning = executions.findLatestRunningExecutions(unique);
        } catch (DataAccessException e) {
            log.debug("Skipping runtime reconciliation: {}", e.getMessage());
            return;
        }

        synchronized (this) {
            latestRunning.forEach((taskId, executionId) -> {
                Entry existing = entries.get(taskId);
                if (existing != null && existing.blockedReason != null) {
                    return;
                }
                Entry e = existing != null ? existing : getOrCreate(taskId);
                if (e.phase == RuntimeTaskPhase.IDLE) {
                    e.phase = RuntimeTaskPhase.RUNNING;
                }
                if (e.executionId == null) {
                    e.executionId = executionId;
                }
                if (existing == null) {
                    log.info("Recovered running state for task {} (execution {})", taskId, executionId);
                }
            });

            for (UUID taskId : unique) {
                if (latestRunning.containsKey(taskId)) continue;
                Entry e = entries.get(taskId);
                if (e == null) continue;
                if (e.phase != RuntimeTaskPhase.IDLE
                        && e.runningAgent == null
                        && e.reviewAgent == null
                        && e.blockedReason == null
                        && e.pendingReason == null) {
                    entries.remove(taskId);
                    log.debug("Dropped stale runtime state for task {}", taskId);
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Entry getOrCreate(UUID taskId) {
        return entries.computeIfAbsent(taskId, Entry::new);
    }

    private void evictIfIdle(Entry e) {
        if (e.isFullyIdle()) {
            entries.remove(e.taskId);
        }
    }

    /** Mutable state behind a view. Only touched while holding the registry monitor. */
    private static final class Entry {
        final UUID taskId;
        RuntimeTaskPhase phase = RuntimeTaskPhase.IDLE;
        UUID executionId;
        int runCount;
        AgentHandle runningAgent;
        AgentHandle reviewAgent;
        String blockedReason;
        List<UUID> blockedByTaskIds = List.of();
        List<String> overlapHints = List.of();
        Instant blockedAt;
        String pendingReason;
        Instant pendingAt;

        Entry(UUID taskId) {
            this.taskId = taskId;
        }

        void clearBlocked() {
            blockedReason    = null;
            blockedByTaskIds = List.of();
            overlapHints     = List.of();
            blockedAt        = null;
        }

        void clearPending() {
            pendingReason = null;
            pendingAt     = null;
        }

        boolean isFullyIdle() {
            return phase == RuntimeTaskPhase.IDLE
                && executionId == null
                && runningAgent == null
                && reviewAgent == null
                && blockedReason == null
                && pendingReason == null;
        }

        RuntimeTaskView snapshot() {
            return new RuntimeTaskView(taskId, phase, executionId, runCount,
                    runningAgent, reviewAgent, blockedReason, blockedByTaskIds,
                    overlapHints, blockedAt, pendingReason, pendingAt);
        }
    }
}
