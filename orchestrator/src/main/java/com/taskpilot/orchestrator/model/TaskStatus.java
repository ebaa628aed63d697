package com.taskpilot.orchestrator.model;

/**
 * Board column of a task.
 *
 * Lifecycle:
 *   BACKLOG → IN_PROGRESS → REVIEW → DONE
 *
 * A rejected review sends the task back to BACKLOG or IN_PROGRESS.
 */
public enum TaskStatus {
    BACKLOG,
    IN_PROGRESS,
    REVIEW,
    DONE
}
