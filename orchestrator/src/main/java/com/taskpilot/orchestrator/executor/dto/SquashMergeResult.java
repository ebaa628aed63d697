package com.taskpilot.orchestrator.executor.dto;

import java.util.List;

/**
 * Outcome of a squash merge on the executor.
 *
 * @param commit_sha     set when a commit landed on the target branch
 * @param conflict_op    git operation that hit a conflict ("merge", "rebase"), or null
 * @param conflict_files paths in conflict, empty when none
 */
public record SquashMergeResult(
        boolean      success,
        String       message,
        String       commit_sha,
        String       conflict_op,
        List<String> conflict_files) {

    public SquashMergeResult {
        conflict_files = conflict_files == null ? List.of() : List.copyOf(conflict_files);
    }
}
