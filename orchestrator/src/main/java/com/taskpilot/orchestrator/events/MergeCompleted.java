package com.taskpilot.orchestrator.events;

import java.time.Instant;

/** A repo's changes landed on its target branch. */
public record MergeCompleted(
        String  workspaceId,
        String  repoId,
        String  targetBranch,
        String  commitSha,
        Instant occurredAt) {

    public MergeCompleted(String workspaceId, String repoId, String targetBranch, String commitSha) {
        this(workspaceId, repoId, targetBranch, commitSha, Instant.now());
    }
}
