package com.taskpilot.orchestrator.merge;

import java.util.List;

/**
 * Rough risk estimate for a merge attempt.
 *
 * Score terms:
 * <pre>
 *   +1  more than one repo changed
 *   +1  6 or more commits
 *   +1  12 or more files changed
 *   +2  a file changed both on the task branch and on base since divergence
 * </pre>
 * A high-risk merge is rebased onto base before it is attempted.
 */
public record MergeRisk(
        int          score,
        List<String> overlapFiles,
        int          commitCount,
        int          changedRepoCount,
        int          changedFileCount) {

    static final int MULTI_REPO_THRESHOLD   = 1;
    static final int COMMIT_THRESHOLD       = 6;
    static final int CHANGED_FILE_THRESHOLD = 12;

    public MergeRisk {
        overlapFiles = overlapFiles == null ? List.of() : List.copyOf(overlapFiles);
    }

    public boolean high() {
        return score >= 2 || !overlapFiles.isEmpty();
    }

    public static MergeRisk assess(int changedRepoCount, int commitCount,
                                   int changedFileCount, List<String> overlapFiles) {
        int score = 0;
        if (changedRepoCount > MULTI_REPO_THRESHOLD)     score += 1;
        if (commitCount >= COMMIT_THRESHOLD)             score += 1;
        if (changedFileCount >= CHANGED_FILE_THRESHOLD)  score += 1;
        if (overlapFiles != null && !overlapFiles.isEmpty()) score += 2;
        return new MergeRisk(score, overlapFiles, commitCount, changedRepoCount, changedFileCount);
    }
}
