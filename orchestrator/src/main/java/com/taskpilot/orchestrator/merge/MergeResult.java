package com.taskpilot.orchestrator.merge;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of merging one repo of a workspace.
 *
 * @param prUrl         set for PULL_REQUEST merges that opened a PR
 * @param commitSha     set for DIRECT merges that produced a commit
 * @param conflictFiles paths git reported in conflict; empty when none
 */
public record MergeResult(
        String        repoId,
        String        repoName,
        MergeStrategy strategy,
        boolean       success,
        String        message,
        String        prUrl,
        String        commitSha,
        String        conflictOp,
        List<String>  conflictFiles) {

    public MergeResult {
        conflictFiles = conflictFiles == null ? List.of() : List.copyOf(conflictFiles);
    }

    public static MergeResult succeeded(String repoId, String repoName, MergeStrategy strategy, String message) {
        return new MergeResult(repoId, repoName, strategy, true, message, null, null, null, List.of());
    }

    public static MergeResult failed(String repoId, String repoName, MergeStrategy strategy, String message) {
        return new MergeResult(repoId, repoName, strategy, false, message, null, null, null, List.of());
    }

    public boolean requiresRebase() {
        return message != null && message.toLowerCase(Locale.ROOT).contains("rebase required");
    }

    public boolean looksLikeConflict() {
        return !conflictFiles.isEmpty()
            || (message != null && message.toLowerCase(Locale.ROOT).contains("conflict"));
    }
}
