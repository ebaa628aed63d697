package com.taskpilot.orchestrator.automation;

import com.taskpilot.orchestrator.model.Task;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * Starts, stops and observes agent runs for AUTO tasks.
 */
public interface AutomationService {

    boolean isRunning(UUID taskId);

    boolean isReviewing(UUID taskId);

    /** Ask the agent for this task to stop. Returns once the stop has been requested. */
    void stopTask(UUID taskId);

    /**
     * Start a fresh agent run for the task.
     *
     * @return false when the run could not be started (wrong task type, already live,
     *         worker pool refused it)
     */
    boolean spawnForTask(Task task);

    /**
     * Block until a running agent is attached for the task or the timeout elapses.
     *
     * @return true when an agent attached in time
     */
    boolean waitForRunningAgent(UUID taskId, Duration timeout) throws InterruptedException;

    /** Process-wide lock that serialises merges when enabled. */
    Lock mergeLock();
}
