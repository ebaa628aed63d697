package com.taskpilot.orchestrator.merge;

/**
 * How a repo's changes reach its target branch.
 */
public enum MergeStrategy {
    DIRECT,         // squash-merge locally
    PULL_REQUEST    // push and open a PR
}
