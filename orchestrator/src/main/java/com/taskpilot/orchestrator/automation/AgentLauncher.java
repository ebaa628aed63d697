package com.taskpilot.orchestrator.automation;

import com.taskpilot.orchestrator.model.Task;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Starts the coding agent for a task inside its worktree.
 */
public interface AgentLauncher {

    AgentProcess launch(Task task, Path worktree) throws IOException;
}
