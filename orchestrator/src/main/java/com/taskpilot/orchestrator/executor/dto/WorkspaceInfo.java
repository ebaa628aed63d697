package com.taskpilot.orchestrator.executor.dto;

/**
 * A task's isolated checkout, as reported by GET /workspaces.
 */
public record WorkspaceInfo(String id, String task_id, String branch_name, String path) {}
