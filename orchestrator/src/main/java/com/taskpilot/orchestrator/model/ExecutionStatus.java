package com.taskpilot.orchestrator.model;

/**
 * Persisted status of one agent run.
 *
 * Transitions:
 *   RUNNING → COMPLETED (agent exited cleanly)
 *   RUNNING → FAILED    (agent exited with an error)
 *   RUNNING → KILLED    (stopped by the user, or recovered as stale)
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    KILLED
}
