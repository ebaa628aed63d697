package com.taskpilot.orchestrator.model;

/**
 * How a task is worked on.
 */
public enum TaskType {
    AUTO,   // An agent runs unattended and streams its output
    PAIR    // A human drives the agent interactively in a terminal session
}
