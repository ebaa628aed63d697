package com.taskpilot.orchestrator.executor.dto;

/**
 * One repository participating in a workspace.
 *
 * @param repo_path     the main checkout that merges land in
 * @param worktree_path the task's worktree for this repo; null if not created yet
 * @param target_branch branch the task merges into
 * @param has_changes   true when the worktree differs from the target branch
 */
public record WorkspaceRepo(
        String  repo_id,
        String  repo_name,
        String  repo_path,
        String  worktree_path,
        String  target_branch,
        boolean has_changes) {}
