package com.taskpilot.orchestrator.merge;

import com.taskpilot.orchestrator.automation.AutomationService;
import com.taskpilot.orchestrator.events.MergeCompleted;
import com.taskpilot.orchestrator.events.MergeFailed;
import com.taskpilot.orchestrator.events.PRCreated;
import com.taskpilot.orchestrator.executor.ExecutorException;
import com.taskpilot.orchestrator.executor.WorkspaceClient;
import com.taskpilot.orchestrator.executor.dto.RebaseResult;
import com.taskpilot.orchestrator.executor.dto.SquashMergeResult;
import com.taskpilot.orchestrator.executor.dto.WorkspaceInfo;
import com.taskpilot.orchestrator.executor.dto.WorkspaceRepo;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.runtime.TaskLocks;
import com.taskpilot.orchestrator.service.TaskService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges a task's branches back into their base branch.
 *
 * <p>{@link #mergeTask} flow:
 * <ol>
 *   <li>Stop the task's agent and wait (bounded) until its runtime is idle.</li>
 *   <li>Resolve the workspace and the base branch
 *       (task override → workspace target → configured default).</li>
 *   <li>Score the merge risk; rebase first when risk is high or when recent
 *       merges into the same base needed a rebase.</li>
 *   <li>Merge every repo. If every failure says "rebase required", rebase once
 *       and retry once.</li>
 *   <li>Success: release the workspace (kept on disk), end the session, move
 *       the task to DONE. Failure: one summary message, task stays in REVIEW.</li>
 * </ol>
 *
 * Merges hold the task's lock, and the process-wide merge lock when
 * {@code taskpilot.merge.serialize-merges} is on.
 */
@Service
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    private static final DateTimeFormatter FEEDBACK_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final int OVERLAP_PREVIEW = 3;

    private final TaskService tasks;
    private final WorkspaceClient workspaces;
    private final AutomationService automation;
    private final ApplicationEventPublisher events;
    private final MeterRegistry meterRegistry;

    private final boolean serializeMerges;
    private final String defaultBaseBranch;
    private final Duration quiesceTimeout;
    private final Duration quiescePoll;

    private final RebaseHints rebaseHints = new RebaseHints();
    private final TaskLocks locks = new TaskLocks();

    public MergeCoordinator(
            TaskService tasks,
            WorkspaceClient workspaces,
            AutomationService automation,
            ApplicationEventPublisher events,
            MeterRegistry meterRegistry,
            @Value("${taskpilot.merge.serialize-merges:true}") boolean serializeMerges,
            @Value("${taskpilot.merge.default-base-branch:main}") String defaultBaseBranch,
            @Value("${taskpilot.merge.quiesce-timeout-ms:5000}") long quiesceTimeoutMs,
            @Value("${taskpilot.merge.quiesce-poll-ms:100}") long quiescePollMs) {
        this.tasks             = Objects.requireNonNull(tasks, "tasks");
        this.workspaces        = Objects.requireNonNull(workspaces, "workspaces");
        this.automation        = Objects.requireNonNull(automation, "automation");
        this.events            = Objects.requireNonNull(events, "events");
        this.meterRegistry     = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.serializeMerges   = serializeMerges;
        this.defaultBaseBranch = defaultBaseBranch;
        this.quiesceTimeout    = Duration.ofMillis(quiesceTimeoutMs);
        this.quiescePoll       = Duration.ofMillis(quiescePollMs);
    }

    // ------------------------------------------------------------------
    // Task-level merge
    // ------------------------------------------------------------------

    public MergeOutcome mergeTask(Task task) {
        Timer.Sample sample = Timer.start(meterRegistry);
        MergeOutcome outcome;
        try {
            outcome = withTaskLock(task.getId(), () -> serializeMerges
                    ? withLock(automation.mergeLock(), () -> doMerge(task))
                    : doMerge(task));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = MergeOutcome.failed("Merge cancelled for task " + task.shortId());
        }

        String tag = outcome.success() ? "success" : "failure";
        sample.stop(meterRegistry.timer("taskpilot.merge.duration", "outcome", tag));
        meterRegistry.counter("taskpilot.merge.attempts", "outcome", tag).increment();
        if (outcome.success()) {
            log.info("Task {} merged: {}", task.shortId(), outcome.message());
        } else {
            log.warn("Task {} not merged: {}", task.shortId(), outcome.message());
        }
        return outcome;
    }

    private MergeOutcome doMerge(Task task) throws InterruptedException {
        Optional<String> busy = awaitQuiescence(task.getId());
        if (busy.isPresent()) {
            return MergeOutcome.failed("Merge blocked: " + busy.get());
        }

        try {
            Optional<WorkspaceInfo> workspace = latestWorkspace(task.getId());
            if (workspace.isEmpty()) {
                return MergeOutcome.failed("Workspace not found for task " + task.getId());
            }
            String workspaceId = workspace.get().id();
            List<WorkspaceRepo> repos = workspaces.getWorkspaceRepos(workspaceId);
            String baseBranch = resolveBaseBranch(task, repos);
            String commitMessage = commitMessage(task);

            boolean skipUnchanged = hasNoChanges(task.getId(), repos, baseBranch);
            MergeRisk risk = assessRisk(task.getId(), repos, baseBranch);
            log.info("Merging task {} into '{}' (risk score={}, overlap={}, rebase hint={})",
                    task.shortId(), baseBranch, risk.score(), risk.overlapFiles().size(),
                    rebaseHints.get(baseBranch));

            boolean usedPremergeRebase = false;
            if (risk.high() || rebaseHints.shouldRebaseFirst(baseBranch)) {
                Optional<String> rebaseError = rebase(task.getId(), baseBranch);
                if (rebaseError.isPresent()) {
                    return MergeOutcome.failed("Merge blocked: " + rebaseError.get());
                }
                usedPremergeRebase = true;
            }

            List<MergeResult> failures = failuresOf(
                    mergeAll(workspaceId, MergeStrategy.DIRECT, skipUnchanged, commitMessage));

            boolean usedAutoRebase = false;
            if (!failures.isEmpty() && failures.stream().allMatch(MergeResult::requiresRebase)) {
                Optional<String> rebaseError = rebase(task.getId(), baseBranch);
                if (rebaseError.isPresent()) {
                    return MergeOutcome.failed("Merge blocked: " + rebaseError.get());
                }
                usedAutoRebase = true;
                failures = failuresOf(
                        mergeAll(workspaceId, MergeStrategy.DIRECT, skipUnchanged, commitMessage));
            }

            if (!failures.isEmpty()) {
                return MergeOutcome.failed(summarizeFailures(failures, risk.overlapFiles()));
            }

            workspaces.release(workspaceId, false, "merged");
            terminateSession(task.getId());
            tasks.move(task.getId(), TaskStatus.DONE);

            if (usedPremergeRebase || usedAutoRebase) {
                rebaseHints.noteRebaseUsed(baseBranch);
            } else {
                rebaseHints.cooldown(baseBranch);
            }

            if (usedAutoRebase)     return MergeOutcome.ok("Merged all repos (after auto-rebase)");
            if (usedPremergeRebase) return MergeOutcome.ok("Merged all repos (after pre-merge rebase)");
            return MergeOutcome.ok("Merged all repos");
        } catch (ExecutorException e) {
            return MergeOutcome.failed("Merge failed: " + e.getMessage());
        }
    }

    /**
     * Stop the task's agent and poll until it is idle.
     *
     * @return empty when idle, otherwise the reason the merge cannot proceed
     */
    Optional<String> awaitQuiescence(UUID taskId) throws InterruptedException {
        if (!isRuntimeActive(taskId)) return Optional.empty();

        try {
            automation.stopTask(taskId);
        } catch (RuntimeException e) {
            log.warn("Stop request for task {} failed: {}", taskId, e.getMessage());
        }

        long deadline = System.nanoTime() + quiesceTimeout.toNanos();
        while (isRuntimeActive(taskId)) {
            if (System.nanoTime() >= deadline) {
                return Optional.of("Task runtime is still active; wait for agent shutdown and retry merge.");
            }
            Thread.sleep(quiescePoll.toMillis());
        }
        return Optional.empty();
    }

    private boolean isRuntimeActive(UUID taskId) {
        return automation.isRunning(taskId) || automation.isReviewing(taskId);
    }

    // ------------------------------------------------------------------
    // Risk and rebase
    // ------------------------------------------------------------------

    MergeRisk assessRisk(UUID taskId, List<WorkspaceRepo> repos, String baseBranch) {
        int changedRepoCount = (int) repos.stream().filter(WorkspaceRepo::has_changes).count();
        List<String> commits = workspaces.commitLog(taskId, baseBranch);
        List<String> changedFiles = workspaces.filesChanged(taskId, baseBranch);
        TreeSet<String> overlap = new TreeSet<>(changedFiles);
        overlap.retainAll(workspaces.filesChangedOnBase(taskId, baseBranch));
        return MergeRisk.assess(changedRepoCount, commits.size(), changedFiles.size(), List.copyOf(overlap));
    }

    /** Current rebase hint counter for a base branch. */
    int rebaseHint(String baseBranch) {
        return rebaseHints.get(baseBranch);
    }

    /**
     * Rebase the task onto base.
     *
     * @return empty on success, otherwise the executor's explanation
     */
    private Optional<String> rebase(UUID taskId, String baseBranch) {
        RebaseResult result = workspaces.rebaseOntoBase(taskId, baseBranch);
        if (result.success()) return Optional.empty();

        try {
            workspaces.abortRebase(taskId);
        } catch (ExecutorException e) {
            log.warn("Could not abort failed rebase for task {}: {}", taskId, e.getMessage());
        }
        String message = result.message();
        if (!result.conflict_files().isEmpty()) {
            message += " (conflicts: " + String.join(", ", result.conflict_files()) + ")";
        }
        return Optional.of(message);
    }

    /** Explicit rebase of the task's worktree onto its base branch. */
    public MergeOutcome rebaseTask(Task task) {
        try {
            Optional<WorkspaceInfo> workspace = latestWorkspace(task.getId());
            if (workspace.isEmpty()) {
                return MergeOutcome.failed("Workspace not found for task " + task.getId());
            }
            String baseBranch = resolveBaseBranch(task, workspaces.getWorkspaceRepos(workspace.get().id()));
            Optional<String> error = rebase(task.getId(), baseBranch);
            return error.map(e -> MergeOutcome.failed("Rebase failed: " + e))
                    .orElseGet(() -> MergeOutcome.ok("Rebased onto " + baseBranch));
        } catch (ExecutorException e) {
            return MergeOutcome.failed("Rebase failed: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Per-repo operations
    // ------------------------------------------------------------------

    /**
     * Merge one repo of a workspace.
     *
     * Uncommitted agent changes are committed first and the branch is pushed.
     * DIRECT squash-merges into the repo's target branch; PULL_REQUEST opens a
     * PR instead. Operational failures come back as a failed result.
     *
     * @throws IllegalArgumentException if the repo is not part of the workspace
     */
    public MergeResult mergeRepo(String workspaceId, String repoId, MergeStrategy strategy,
                                 String prTitle, String prBody, String commitMessage) {
        WorkspaceRepo repo = workspaces.getWorkspaceRepos(workspaceId).stream()
                .filter(r -> r.repo_id().equals(repoId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Repo " + repoId + " not found in workspace " + workspaceId));
        if (repo.worktree_path() == null) {
            throw new IllegalArgumentException("Repo " + repoId + " has no worktree for workspace " + workspaceId);
        }
        WorkspaceInfo workspace = workspaces.getWorkspace(workspaceId);

        try {
            if (workspaces.hasUncommittedChanges(repo.worktree_path())) {
                String shortId = workspace.task_id() == null ? "unknown"
                        : workspace.task_id().substring(0, Math.min(8, workspace.task_id().length()));
                workspaces.commitAll(repo.worktree_path(),
                        "chore: adding uncommitted agent changes (" + shortId + ")");
                log.info("Auto-committed changes before merge for repo {}", repo.repo_name());
            }
            workspaces.push(repo.worktree_path(), workspace.branch_name());
        } catch (ExecutorException e) {
            return fail(workspaceId, repo, strategy, e.getMessage());
        }

        if (strategy == MergeStrategy.PULL_REQUEST) {
            try {
                String prUrl = workspaces.createPullRequest(repo.repo_path(), workspace.branch_name(),
                        repo.target_branch(),
                        prTitle != null ? prTitle : "Merge " + workspace.branch_name(),
                        prBody != null ? prBody : "");
                events.publishEvent(new PRCreated(workspaceId, repoId, prUrl));
                return new MergeResult(repoId, repo.repo_name(), strategy, true,
                        "PR created: " + prUrl, prUrl, null, null, List.of());
            } catch (ExecutorException e) {
                return fail(workspaceId, repo, strategy, "Failed to create PR: " + e.getMessage());
            }
        }

        if (isRemoteTarget(repo.target_branch())) {
            return fail(workspaceId, repo, strategy,
                    "Direct merge blocked for remote target " + repo.target_branch());
        }

        SquashMergeResult git;
        try {
            git = workspaces.squashMerge(repo.repo_path(), workspace.branch_name(),
                    repo.target_branch(), commitMessage);
        } catch (ExecutorException e) {
            return fail(workspaceId, repo, strategy, e.getMessage());
        }

        if (!git.success()) {
            events.publishEvent(new MergeFailed(workspaceId, repoId, git.message(),
                    git.conflict_op(), git.conflict_files()));
            return new MergeResult(repoId, repo.repo_name(), strategy, false, git.message(),
                    null, null, git.conflict_op(), git.conflict_files());
        }
        if (git.commit_sha() != null) {
            events.publishEvent(new MergeCompleted(workspaceId, repoId, repo.target_branch(), git.commit_sha()));
        }
        return new MergeResult(repoId, repo.repo_name(), strategy, true, git.message(),
                null, git.commit_sha(), null, List.of());
    }

    /**
     * Merge every repo of a workspace in order.
     *
     * @param skipUnchanged report repos without changes as skipped instead of merging them
     */
    public List<MergeResult> mergeAll(String workspaceId, MergeStrategy strategy,
                                      boolean skipUnchanged, String commitMessage) {
        List<MergeResult> results = new ArrayList<>();
        for (WorkspaceRepo repo : workspaces.getWorkspaceRepos(workspaceId)) {
            if (skipUnchanged && !repo.has_changes()) {
                results.add(MergeResult.succeeded(repo.repo_id(), repo.repo_name(), strategy,
                        "Skipped (no changes)"));
                continue;
            }
            results.add(mergeRepo(workspaceId, repo.repo_id(), strategy, null, null, commitMessage));
        }
        return results;
    }

    /**
     * Open a pull request for one repo.
     *
     * @return the PR URL
     * @throws IllegalStateException when no PR was created
     */
    public String createPr(String workspaceId, String repoId, String title, String body) {
        MergeResult result = mergeRepo(workspaceId, repoId, MergeStrategy.PULL_REQUEST, title, body, null);
        if (result.prUrl() == null) {
            throw new IllegalStateException("PR creation failed: " + result.message());
        }
        return result.prUrl();
    }

    // ------------------------------------------------------------------
    // Other review outcomes
    // ------------------------------------------------------------------

    /** True when the task has no workspace, or no repo changes and no commits ahead of base. */
    public boolean hasNoChanges(Task task) {
        Optional<WorkspaceInfo> workspace = latestWorkspace(task.getId());
        if (workspace.isEmpty()) return true;
        List<WorkspaceRepo> repos = workspaces.getWorkspaceRepos(workspace.get().id());
        return hasNoChanges(task.getId(), repos, resolveBaseBranch(task, repos));
    }

    private boolean hasNoChanges(UUID taskId, List<WorkspaceRepo> repos, String baseBranch) {
        if (repos.stream().anyMatch(WorkspaceRepo::has_changes)) return false;
        return workspaces.commitLog(taskId, baseBranch).isEmpty();
    }

    /** Finish a task that produced nothing to merge. */
    public MergeOutcome closeExploratory(Task task) {
        if (automation.isRunning(task.getId())) {
            automation.stopTask(task.getId());
        }
        terminateSession(task.getId());
        try {
            latestWorkspace(task.getId())
                    .ifPresent(ws -> workspaces.release(ws.id(), false, "no_changes"));
        } catch (ExecutorException e) {
            log.warn("Could not release workspace of task {}: {}", task.shortId(), e.getMessage());
        }
        tasks.move(task.getId(), TaskStatus.DONE);
        return MergeOutcome.ok("Closed with no changes");
    }

    /**
     * Send a reviewed task back, appending the reviewer's feedback to its description.
     *
     * @param action "backlog" moves the task to BACKLOG, anything else to IN_PROGRESS
     */
    public Task applyRejectionFeedback(Task task, String feedback, String action) {
        TaskStatus target = "backlog".equalsIgnoreCase(action) ? TaskStatus.BACKLOG : TaskStatus.IN_PROGRESS;
        if (feedback != null && !feedback.isBlank()) {
            String description = task.getDescription() == null ? "" : task.getDescription();
            description += "\n\n---\n**Review Feedback (" + LocalDateTime.now().format(FEEDBACK_TIMESTAMP)
                    + "):**\n" + feedback;
            tasks.updateFields(task.getId(), null, description, null);
        }
        return tasks.move(task.getId(), target);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<WorkspaceInfo> latestWorkspace(UUID taskId) {
        return workspaces.listWorkspaces(taskId).stream().findFirst();
    }

    String resolveBaseBranch(Task task, List<WorkspaceRepo> repos) {
        if (task.getBaseBranch() != null && !task.getBaseBranch().isBlank()) {
            return task.getBaseBranch();
        }
        return repos.stream()
                .map(WorkspaceRepo::target_branch)
                .filter(b -> b != null && !b.isBlank())
                .findFirst()
                .orElse(defaultBaseBranch);
    }

    private static String commitMessage(Task task) {
        String msg = task.getTitle() + " (taskpilot " + task.shortId() + ")";
        if (task.getDescription() != null && !task.getDescription().isBlank()) {
            msg += "\n\n" + task.getDescription();
        }
        return msg;
    }

    private void terminateSession(UUID taskId) {
        try {
            workspaces.terminateSession(taskId);
        } catch (ExecutorException e) {
            log.warn("Could not terminate session for task {}: {}", taskId, e.getMessage());
        }
    }

    private MergeResult fail(String workspaceId, WorkspaceRepo repo, MergeStrategy strategy, String message) {
        events.publishEvent(new MergeFailed(workspaceId, repo.repo_id(), message));
        return MergeResult.failed(repo.repo_id(), repo.repo_name(), strategy, message);
    }

    private static List<MergeResult> failuresOf(List<MergeResult> results) {
        return results.stream().filter(r -> !r.success()).toList();
    }

    static boolean isRemoteTarget(String targetBranch) {
        return targetBranch != null
            && (targetBranch.startsWith("origin/") || targetBranch.startsWith("refs/remotes/"));
    }

    static String summarizeFailures(List<MergeResult> failures, List<String> overlapFiles) {
        StringBuilder message = new StringBuilder();
        for (MergeResult f : failures) {
            if (message.length() > 0) message.append("; ");
            message.append(f.repoName()).append(": ").append(f.message());
        }

        List<String> hints = new ArrayList<>();
        if (failures.stream().anyMatch(MergeResult::looksLikeConflict)) {
            hints.add("Tip: run review rebase, resolve conflicts, then merge again");
        }
        if (!overlapFiles.isEmpty()) {
            String preview = String.join(", ", overlapFiles.subList(0, Math.min(OVERLAP_PREVIEW, overlapFiles.size())));
            String suffix = overlapFiles.size() > OVERLAP_PREVIEW ? "..." : "";
            hints.add("Potential overlap with base changes: " + preview + suffix);
        }
        if (!hints.isEmpty()) {
            message.append(". ").append(String.join(" ", hints));
        }
        return MergeOutcome.truncate(message.toString());
    }

    // ------------------------------------------------------------------
    // Locking
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface LockedAction {
        MergeOutcome run() throws InterruptedException;
    }

    private MergeOutcome withTaskLock(UUID taskId, LockedAction action) throws InterruptedException {
        ReentrantLock lock = locks.forTask(taskId);
        return withLock(lock, action);
    }

    private static MergeOutcome withLock(Lock lock, LockedAction action) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }
}
