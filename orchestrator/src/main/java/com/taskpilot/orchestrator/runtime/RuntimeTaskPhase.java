package com.taskpilot.orchestrator.runtime;

/**
 * Live phase of a task's agent, as seen by this process.
 */
public enum RuntimeTaskPhase {
    IDLE,
    RUNNING,
    REVIEWING
}
