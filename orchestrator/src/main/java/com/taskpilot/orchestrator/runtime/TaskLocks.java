package com.taskpilot.orchestrator.runtime;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per task id, created on first use.
 *
 * Held for the whole of an operation that waits on I/O (merge, stale
 * recovery) so two overlapping calls for the same task cannot interleave.
 */
public class TaskLocks {

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock forTask(UUID taskId) {
        return locks.computeIfAbsent(taskId, id -> new ReentrantLock());
    }
}
