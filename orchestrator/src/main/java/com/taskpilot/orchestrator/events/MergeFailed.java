package com.taskpilot.orchestrator.events;

import java.time.Instant;
import java.util.List;

/** A repo could not be merged. conflictOp and conflictFiles are set only for git conflicts. */
public record MergeFailed(
        String       workspaceId,
        String       repoId,
        String       error,
        String       conflictOp,
        List<String> conflictFiles,
        Instant      occurredAt) {

    public MergeFailed(String workspaceId, String repoId, String error) {
        this(workspaceId, repoId, error, null, List.of(), Instant.now());
    }

    public MergeFailed(String workspaceId, String repoId, String error,
                       String conflictOp, List<String> conflictFiles) {
        this(workspaceId, repoId, error, conflictOp,
             conflictFiles == null ? List.of() : conflictFiles, Instant.now());
    }
}
