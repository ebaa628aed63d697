package com.taskpilot.orchestrator.automation;

import com.taskpilot.orchestrator.executor.WorkspaceClient;
import com.taskpilot.orchestrator.executor.dto.WorkspaceInfo;
import com.taskpilot.orchestrator.model.Execution;
import com.taskpilot.orchestrator.model.ExecutionLog;
import com.taskpilot.orchestrator.model.ExecutionStatus;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.repository.ExecutionLogRepository;
import com.taskpilot.orchestrator.repository.ExecutionRepository;
import com.taskpilot.orchestrator.runtime.AgentHandle;
import com.taskpilot.orchestrator.runtime.RuntimeRegistry;
import com.taskpilot.orchestrator.runtime.RuntimeTaskView;
import com.taskpilot.orchestrator.service.TaskService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs agents for AUTO tasks on a fixed worker pool.
 *
 * One run:
 * <ol>
 *   <li>{@link #spawnForTask} persists a RUNNING execution, marks the task
 *       started in the registry, moves it to IN_PROGRESS and queues the run,
 *       after the surrounding transaction commits when there is one.</li>
 *   <li>A worker launches the agent in the task's worktree, attaches its
 *       handle, and stores every output line as an execution log.</li>
 *   <li>On exit the execution becomes COMPLETED or FAILED and the registry
 *       entry is dropped. A clean exit moves the task to REVIEW.</li>
 * </ol>
 *
 * A run stopped through {@link #stopTask} is finalised there (KILLED) and its
 * process is killed. The registry keeps reporting the task as running until
 * the worker has seen the process exit; the worker leaves the execution alone.
 */
@Service
public class AgentScheduler implements AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AgentScheduler.class);

    private static final Duration ATTACH_POLL = Duration.ofMillis(50);

    private final RuntimeRegistry        registry;
    private final ExecutionRepository    executions;
    private final ExecutionLogRepository executionLogs;
    private final TaskService            tasks;
    private final WorkspaceClient        workspaces;
    private final AgentLauncher          launcher;
    private final MeterRegistry          meterRegistry;
    private final Executor               workers;

    private final Map<UUID, AgentProcess> live = new ConcurrentHashMap<>();
    private final ReentrantLock mergeLock = new ReentrantLock();

    @Autowired
    public AgentScheduler(RuntimeRegistry registry,
                          ExecutionRepository executions,
                          ExecutionLogRepository executionLogs,
                          TaskService tasks,
                          WorkspaceClient workspaces,
                          AgentLauncher launcher,
                          MeterRegistry meterRegistry,
                          @Value("${taskpilot.automation.max-concurrent-agents:4}") int maxConcurrentAgents) {
        this(registry, executions, executionLogs, tasks, workspaces, launcher, meterRegistry,
                Executors.newFixedThreadPool(maxConcurrentAgents));
    }

    AgentScheduler(RuntimeRegistry registry,
                   ExecutionRepository executions,
                   ExecutionLogRepository executionLogs,
                   TaskService tasks,
                   WorkspaceClient workspaces,
                   AgentLauncher launcher,
                   MeterRegistry meterRegistry,
                   Executor workers) {
        this.registry      = registry;
        this.executions    = executions;
        this.executionLogs = executionLogs;
        this.tasks         = tasks;
        this.workspaces    = workspaces;
        this.launcher      = launcher;
        this.meterRegistry = meterRegistry;
        this.workers       = workers;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Override
    public boolean isRunning(UUID taskId) {
        return registry.get(taskId).map(RuntimeTaskView::isRunning).orElse(false);
    }

    @Override
    public boolean isReviewing(UUID taskId) {
        return registry.get(taskId).map(RuntimeTaskView::isReviewing).orElse(false);
    }

    @Override
    public Lock mergeLock() {
        return mergeLock;
    }

    // ------------------------------------------------------------------
    // Start / stop
    // ------------------------------------------------------------------

    @Override
    public boolean spawnForTask(Task task) {
        UUID taskId = task.getId();
        if (!task.isAuto()) {
            log.warn("Refusing to spawn agent for non-AUTO task {}", task.shortId());
            return false;
        }
        if (isRunning(taskId) || live.containsKey(taskId)) {
            log.info("Agent for task {} is already live", task.shortId());
            return false;
        }

        int runCount = (int) executions.countByTaskId(taskId) + 1;
        Execution execution = executions.save(new Execution(taskId, runCount));
        registry.markStarted(taskId);
        registry.setExecution(taskId, execution.getId(), runCount);
        tasks.move(taskId, TaskStatus.IN_PROGRESS);

        // Workers read the execution in their own transaction, so it must be committed first.
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_COMMITTED) {
                        queue(task, execution.getId(), runCount);
                    } else {
                        log.info("Run {} of task {} rolled back before it was queued", runCount, task.shortId());
                        clearEntry(taskId, execution.getId());
                    }
                }
            });
            log.info("Run {} of task {} (execution {}) queued on commit", runCount, task.shortId(), execution.getId());
            return true;
        }
        return queue(task, execution.getId(), runCount);
    }

    private boolean queue(Task task, UUID executionId, int runCount) {
        try {
            workers.execute(() -> runAgent(task, executionId));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool refused run {} of task {}", runCount, task.shortId());
            finish(task.getId(), executionId, ExecutionStatus.FAILED, "Worker pool refused the run");
            return false;
        }
        log.info("Queued run {} of task {} (execution {})", runCount, task.shortId(), executionId);
        return true;
    }

    @Override
    public void stopTask(UUID taskId) {
        executions.findFirstByTaskIdOrderByStartedAtDesc(taskId)
                .filter(Execution::isRunning)
                .ifPresent(e -> {
                    e.setStatus(ExecutionStatus.KILLED);
                    e.setCompletedAt(Instant.now());
                    e.setError("Stopped by request");
                    executions.save(e);
                    meterRegistry.counter("taskpilot.agent.runs", "outcome", "killed").increment();
                });

        AgentProcess process = live.get(taskId);
        if (process == null) {
            registry.markEnded(taskId);
            return;
        }
        // The task stays running until the worker sees the process exit.
        log.info("Killing agent {} of task {}", process.id(), taskId);
        process.kill();
    }

    @Override
    public boolean waitForRunningAgent(UUID taskId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<RuntimeTaskView> view = registry.get(taskId);
            if (view.isPresent() && view.get().runningAgent() != null) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(ATTACH_POLL.toMillis());
        }
    }

    @PreDestroy
    void shutdown() {
        live.values().forEach(AgentProcess::kill);
        if (workers instanceof ExecutorService pool) {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Worker body
    // ------------------------------------------------------------------

    void runAgent(Task task, UUID executionId) {
        UUID taskId = task.getId();
        try {
            if (!stillRunning(executionId)) {
                log.info("Run {} of task {} was stopped before launch", executionId, task.shortId());
                clearEntry(taskId, executionId);
                return;
            }
            Path worktree = workspaces.listWorkspaces(taskId).stream()
                    .findFirst()
                    .map(WorkspaceInfo::path)
                    .map(Path::of)
                    .orElseThrow(() -> new IllegalStateException("No workspace for task " + taskId));

            AgentProcess process = launcher.launch(task, worktree);
            live.put(taskId, process);
            if (!stillRunning(executionId)) {
                process.kill();
                process.waitFor();
                clearEntry(taskId, executionId);
                return;
            }
            registry.attachRunningAgent(taskId, new AgentHandle(process.id()));

            process.forEachOutputLine(line -> executionLogs.save(new ExecutionLog(executionId, line)));
            int exitCode = process.waitFor();

            if (exitCode == 0) {
                if (finish(taskId, executionId, ExecutionStatus.COMPLETED, null)) {
                    tasks.move(taskId, TaskStatus.REVIEW);
                }
            } else {
                finish(taskId, executionId, ExecutionStatus.FAILED, "Agent exited with code " + exitCode);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(taskId, executionId, ExecutionStatus.KILLED, "Worker interrupted");
        } catch (Exception e) {
            log.error("Agent run {} for task {} failed: {}", executionId, task.shortId(), e.getMessage(), e);
            finish(taskId, executionId, ExecutionStatus.FAILED, e.getMessage());
        } finally {
            live.remove(taskId);
        }
    }

    /**
     * Record the end of a run, unless something else already did.
     *
     * @return true when this call moved the execution out of RUNNING
     */
    private boolean finish(UUID taskId, UUID executionId, ExecutionStatus status, String error) {
        Optional<Execution> current = executions.findById(executionId).filter(Execution::isRunning);
        if (current.isPresent()) {
            Execution e = current.get();
            e.setStatus(status);
            e.setCompletedAt(Instant.now());
            e.setError(error);
            executions.save(e);
            meterRegistry.counter("taskpilot.agent.runs", "outcome", status.name().toLowerCase(Locale.ROOT)).increment();
            log.info("Execution {} of task {} finished: {}", executionId, taskId, status);
        }

        clearEntry(taskId, executionId);
        return current.isPresent();
    }

    /** Drop the registry entry if it still belongs to this run; a newer run may own it. */
    private void clearEntry(UUID taskId, UUID executionId) {
        boolean ownsEntry = registry.get(taskId)
                .map(v -> executionId.equals(v.executionId()))
                .orElse(false);
        if (ownsEntry) {
            registry.markEnded(taskId);
        }
    }

    private boolean stillRunning(UUID executionId) {
        return executions.findById(executionId).map(Execution::isRunning).orElse(false);
    }
}
