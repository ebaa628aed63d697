package com.taskpilot.orchestrator.merge;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-base-branch memory of "merges into this branch keep needing a rebase".
 *
 * The counter goes up by one (max {@value #MAX}) after a merge that needed a
 * rebase and down by one after a merge that did not. While it is above zero,
 * merges into that branch rebase first.
 */
public class RebaseHints {

    static final int MAX = 3;

    private final Map<String, Integer> counters = new ConcurrentHashMap<>();

    public boolean shouldRebaseFirst(String baseBranch) {
        return get(baseBranch) > 0;
    }

    public int get(String baseBranch) {
        return counters.getOrDefault(baseBranch, 0);
    }

    public void noteRebaseUsed(String baseBranch) {
        counters.merge(baseBranch, 1, (old, one) -> Math.min(old + one, MAX));
    }

    public void cooldown(String baseBranch) {
        counters.computeIfPresent(baseBranch, (branch, hint) -> hint <= 1 ? null : hint - 1);
    }
}
