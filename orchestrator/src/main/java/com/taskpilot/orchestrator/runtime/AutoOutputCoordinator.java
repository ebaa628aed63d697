package com.taskpilot.orchestrator.runtime;

import com.taskpilot.orchestrator.automation.AutomationService;
import com.taskpilot.orchestrator.model.Execution;
import com.taskpilot.orchestrator.model.ExecutionStatus;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.repository.ExecutionLogRepository;
import com.taskpilot.orchestrator.repository.ExecutionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides where the output view of an AUTO task gets its content from, and
 * recovers executions left RUNNING by a host that died mid-run.
 *
 * Both operations run under the task's lock: recovery spawns a new agent run,
 * and two overlapping recoveries must not spawn twice.
 */
@Service
public class AutoOutputCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AutoOutputCoordinator.class);

    static final String NO_LOGS_MESSAGE = "No agent logs available for this task";
    static final String NON_AUTO_MESSAGE = "Output stream is only available for AUTO tasks";
    static final String RUNNING_WITHOUT_AGENT_MESSAGE =
            "Agent is starting. Opening output while live stream attaches.";
    static final String STALE_READY_MESSAGE =
            "Stale running execution detected. Recover output to restart the agent.";
    static final String STALE_ERROR = "Recovered stale running execution without live agent";
    static final String RECOVERED_MESSAGE = "Recovered stale execution; starting a fresh agent run.";
    static final String NOT_REQUIRED_MESSAGE = "Stale AUTO output recovery is not required.";
    static final String NO_AUTOMATION_MESSAGE =
            "Recovered stale execution, but automation service is unavailable.";
    static final String SPAWN_FAILED_MESSAGE =
            "Recovered stale execution, but failed to start a fresh agent run.";
    static final String NO_LIVE_RUNTIME_MESSAGE =
            "Recovered stale execution, but no live agent stream is available yet.";
    static final String CANCELLED_MESSAGE = "Output request was cancelled.";

    private final RuntimeRegistry registry;
    private final ExecutionRepository executions;
    private final ExecutionLogRepository executionLogs;
    private final ObjectProvider<AutomationService> automation;
    private final MeterRegistry meterRegistry;
    private final Duration attachTimeout;
    private final TaskLocks locks = new TaskLocks();

    public AutoOutputCoordinator(
            RuntimeRegistry registry,
            ExecutionRepository executions,
            ExecutionLogRepository executionLogs,
            ObjectProvider<AutomationService> automation,
            MeterRegistry meterRegistry,
            @Value("${taskpilot.automation.attach-timeout-ms:2000}") long attachTimeoutMs) {
        this.registry      = registry;
        this.executions    = executions;
        this.executionLogs = executionLogs;
        this.automation    = automation;
        this.meterRegistry = meterRegistry;
        this.attachTimeout = Duration.ofMillis(attachTimeoutMs);
    }

    // ------------------------------------------------------------------
    // Readiness
    // ------------------------------------------------------------------

    /**
     * Resolve the output mode for a task.
     *
     * Order:
     * <ol>
     *   <li>live agent attached → LIVE</li>
     *   <li>registry says RUNNING without an agent: re-read the execution. If it
     *       finished, drop the registry entry and continue below. Otherwise
     *       BACKFILL when it has logged output, WAITING when it has not.</li>
     *   <li>nothing live: fall back to the latest persisted execution.</li>
     * </ol>
     */
    public AutoOutputReadiness prepareOutput(Task task) {
        if (!task.isAuto()) {
            return AutoOutputReadiness.unavailable(NON_AUTO_MESSAGE);
        }
        ReentrantLock lock = locks.forTask(task.getId());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AutoOutputReadiness.unavailable(CANCELLED_MESSAGE);
        }
        try {
            return resolveReadiness(task.getId());
        } finally {
            lock.unlock();
        }
    }

    private AutoOutputReadiness resolveReadiness(UUID taskId) {
        Optional<RuntimeTaskView> view = registry.get(taskId);
        String blockedMessage = view.filter(RuntimeTaskView::isBlocked)
                .map(RuntimeTaskView::blockedReason).orElse(null);
        String pendingMessage = view.filter(RuntimeTaskView::isPending)
                .map(RuntimeTaskView::pendingReason).orElse(null);

        if (view.isPresent() && view.get().isRunning()) {
            RuntimeTaskView live = view.get();
            if (live.runningAgent() != null) {
                return AutoOutputReadiness.of(AutoOutputMode.LIVE, live.executionId(),
                        live.runningAgent(), true, null);
            }
            if (live.executionId() == null) {
                return AutoOutputReadiness.of(AutoOutputMode.WAITING, null, null, true,
                        RUNNING_WITHOUT_AGENT_MESSAGE);
            }

            Optional<Execution> execution = executions.findById(live.executionId());
            if (execution.isEmpty() || !execution.get().isRunning()) {
                // Run finished while nobody was watching; the registry entry is stale.
                registry.markEnded(taskId);
                blockedMessage = null;
                pendingMessage = null;
            } else if (executionLogs.hasContent(live.executionId())) {
                return AutoOutputReadiness.of(AutoOutputMode.BACKFILL, live.executionId(),
                        null, false, blockedMessage);
            } else {
                return AutoOutputReadiness.of(AutoOutputMode.WAITING, live.executionId(),
                        null, true, RUNNING_WITHOUT_AGENT_MESSAGE);
            }
        }

        String fallbackMessage = firstNonNull(blockedMessage, pendingMessage, NO_LOGS_MESSAGE);

        Optional<Execution> latest = executions.findFirstByTaskIdOrderByStartedAtDesc(taskId);
        if (latest.isEmpty()) {
            return AutoOutputReadiness.unavailable(fallbackMessage);
        }

        Execution execution = latest.get();
        if (executionLogs.hasContent(execution.getId())) {
            return AutoOutputReadiness.of(AutoOutputMode.BACKFILL, execution.getId(), null, false,
                    firstNonNull(blockedMessage, pendingMessage, null));
        }
        if (execution.isRunning()) {
            return AutoOutputReadiness.of(AutoOutputMode.WAITING, execution.getId(), null, false,
                    STALE_READY_MESSAGE);
        }
        return AutoOutputReadiness.unavailable(fallbackMessage);
    }

    // ------------------------------------------------------------------
    // Stale recovery
    // ------------------------------------------------------------------

    /**
     * Kill a stale RUNNING execution and start a fresh run.
     *
     * Only acts when nothing is live in this process and the latest execution
     * is RUNNING with no logged output at all. A run that has logged anything
     * is left alone. Never throws; every outcome is reported in the result.
     */
    public AutoOutputRecoveryResult recoverStaleOutput(Task task) {
        if (!task.isAuto()) {
            return AutoOutputRecoveryResult.failed(NON_AUTO_MESSAGE);
        }
        ReentrantLock lock = locks.forTask(task.getId());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AutoOutputRecoveryResult.failed(CANCELLED_MESSAGE);
        }
        try {
            AutoOutputRecoveryResult result = recoverLocked(task);
            meterRegistry.counter("taskpilot.output.recoveries",
                    "outcome", result.success() ? "success" : "failure").increment();
            return result;
        } catch (RuntimeException e) {
            log.error("Stale output recovery failed for task {}: {}", task.getId(), e.getMessage(), e);
            return AutoOutputRecoveryResult.failed("Stale output recovery failed: " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private AutoOutputRecoveryResult recoverLocked(Task task) {
        UUID taskId = task.getId();
        if (registry.get(taskId).filter(RuntimeTaskView::isRunning).isPresent()) {
            return AutoOutputRecoveryResult.failed(NOT_REQUIRED_MESSAGE);
        }

        Optional<Execution> latest = executions.findFirstByTaskIdOrderByStartedAtDesc(taskId);
        if (latest.isEmpty() || !latest.get().isRunning()
                || executionLogs.hasContent(latest.get().getId())) {
            return AutoOutputRecoveryResult.failed(NOT_REQUIRED_MESSAGE);
        }

        Execution stale = latest.get();
        stale.setStatus(ExecutionStatus.KILLED);
        stale.setCompletedAt(Instant.now());
        stale.setError(STALE_ERROR);
        executions.save(stale);
        log.warn("Marked stale execution {} of task {} as KILLED", stale.getId(), taskId);

        AutomationService service = automation.getIfAvailable();
        if (service == null) {
            return AutoOutputRecoveryResult.failed(NO_AUTOMATION_MESSAGE);
        }

        if (!service.spawnForTask(task)) {
            return AutoOutputRecoveryResult.failed(SPAWN_FAILED_MESSAGE);
        }

        try {
            service.waitForRunningAgent(taskId, attachTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AutoOutputRecoveryResult.failed(NO_LIVE_RUNTIME_MESSAGE);
        }

        boolean attached = registry.get(taskId)
                .map(RuntimeTaskView::runningAgent)
                .isPresent();
        if (attached) {
            log.info("Recovered AUTO output for task {}", taskId);
            return AutoOutputRecoveryResult.ok(RECOVERED_MESSAGE);
        }
        return AutoOutputRecoveryResult.failed(NO_LIVE_RUNTIME_MESSAGE);
    }

    private static String firstNonNull(String a, String b, String fallback) {
        if (a != null) return a;
        if (b != null) return b;
        return fallback;
    }
}
