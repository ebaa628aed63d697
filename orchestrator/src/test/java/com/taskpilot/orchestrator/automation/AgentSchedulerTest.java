package com.taskpilot.orchestrator.automation;

import com.taskpilot.orchestrator.TestEntities;
import com.taskpilot.orchestrator.executor.WorkspaceClient;
import com.taskpilot.orchestrator.executor.dto.WorkspaceInfo;
import com.taskpilot.orchestrator.model.Execution;
import com.taskpilot.orchestrator.model.ExecutionLog;
import com.taskpilot.orchestrator.model.ExecutionStatus;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.model.TaskType;
import com.taskpilot.orchestrator.repository.ExecutionLogRepository;
import com.taskpilot.orchestrator.repository.ExecutionRepository;
import com.taskpilot.orchestrator.runtime.AgentHandle;
import com.taskpilot.orchestrator.runtime.RuntimeRegistry;
import com.taskpilot.orchestrator.runtime.RuntimeTaskView;
import com.taskpilot.orchestrator.service.TaskService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AgentScheduler.
 *
 * Runs are queued on a list instead of a thread pool and executed by the test
 * on its own thread; agent processes are fakes.
 */
@ExtendWith(MockitoExtension.class)
class AgentSchedulerTest {

    @Mock ExecutionRepository    executions;
    @Mock ExecutionLogRepository executionLogs;
    @Mock TaskService            tasks;
    @Mock WorkspaceClient        workspaces;
    @Mock AgentLauncher          launcher;

    RuntimeRegistry     registry;
    SimpleMeterRegistry meterRegistry;
    List<Runnable>      queued;
    AgentScheduler      scheduler;

    Task      task;
    UUID      executionId;
    Execution saved;

    @BeforeEach
    void setUp() {
        registry      = new RuntimeRegistry(executions);
        meterRegistry = new SimpleMeterRegistry();
        queued        = new ArrayList<>();
        scheduler     = new AgentScheduler(registry, executions, executionLogs, tasks, workspaces,
                launcher, meterRegistry, queued::add);
        task          = TestEntities.autoTask();
        executionId   = UUID.randomUUID();
    }

    // ------------------------------------------------------------------
    // spawnForTask()
    // ------------------------------------------------------------------

    @Test
    void spawnForTask_autoTask_persistsExecutionAndQueuesRun() {
        givenExecutionStore();
        when(executions.countByTaskId(task.getId())).thenReturn(2L);

        assertThat(scheduler.spawnForTask(task)).isTrue();

        RuntimeTaskView view = registry.get(task.getId()).orElseThrow();
        assertThat(view.isRunning()).isTrue();
        assertThat(view.executionId()).isEqualTo(executionId);
        assertThat(view.runCount()).isEqualTo(3);
        assertThat(saved.getRunCount()).isEqualTo(3);
        assertThat(queued).hasSize(1);
        verify(tasks).move(task.getId(), TaskStatus.IN_PROGRESS);
        assertThat(scheduler.isRunning(task.getId())).isTrue();
    }

    @Test
    void spawnForTask_pairTask_isRefused() {
        Task pair = TestEntities.task(TaskType.PAIR);

        assertThat(scheduler.spawnForTask(pair)).isFalse();

        verifyNoInteractions(executions, tasks);
        assertThat(queued).isEmpty();
    }

    @Test
    void spawnForTask_alreadyRunning_isRefused() {
        registry.markStarted(task.getId());

        assertThat(scheduler.spawnForTask(task)).isFalse();

        verifyNoInteractions(executions);
    }

    @Test
    void spawnForTask_workerPoolRefuses_failsExecutionAndClearsRuntime() {
        givenExecutionStore();
        scheduler = new AgentScheduler(registry, executions, executionLogs, tasks, workspaces,
                launcher, meterRegistry, r -> { throw new RejectedExecutionException("pool shut down"); });

        assertThat(scheduler.spawnForTask(task)).isFalse();

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(registry.get(task.getId())).isEmpty();
    }

    @Test
    void spawnForTask_insideTransaction_queuesRunOnlyAfterCommit() {
        givenExecutionStore();
        TransactionSynchronizationManager.initSynchronization();
        try {
            assertThat(scheduler.spawnForTask(task)).isTrue();
            assertThat(queued).isEmpty();

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(queued).hasSize(1);
        assertThat(scheduler.isRunning(task.getId())).isTrue();
    }

    @Test
    void spawnForTask_transactionRolledBack_clearsRuntimeWithoutQueueing() {
        givenExecutionStore();
        TransactionSynchronizationManager.initSynchronization();
        try {
            scheduler.spawnForTask(task);

            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        assertThat(queued).isEmpty();
        assertThat(registry.get(task.getId())).isEmpty();
    }

    // ------------------------------------------------------------------
    // Worker body
    // ------------------------------------------------------------------

    @Test
    void run_executionNotVisible_clearsRuntimeWithoutLaunching() {
        givenExecutionStore();

        scheduler.spawnForTask(task);
        saved = null;
        queued.get(0).run();

        assertThat(registry.get(task.getId())).isEmpty();
        verifyNoInteractions(launcher);
    }

    @Test
    void run_cleanExit_storesOutputCompletesAndMovesToReview() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        FakeProcess process = new FakeProcess("agent-1", List.of("reading files", "done"), 0);
        when(launcher.launch(task, Path.of("/wt"))).thenReturn(process);

        scheduler.spawnForTask(task);
        queued.get(0).run();

        ArgumentCaptor<ExecutionLog> logs = ArgumentCaptor.forClass(ExecutionLog.class);
        verify(executionLogs, times(2)).save(logs.capture());
        assertThat(logs.getAllValues()).extracting(ExecutionLog::getLogs).containsExactly("reading files", "done");
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(saved.getCompletedAt()).isNotNull();
        verify(tasks).move(task.getId(), TaskStatus.REVIEW);
        assertThat(registry.get(task.getId())).isEmpty();
        assertThat(meterRegistry.counter("taskpilot.agent.runs", "outcome", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void run_agentAttachesWhileRunning() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        List<AgentHandle> seen = new ArrayList<>();
        FakeProcess process = new FakeProcess("agent-1", List.of("working"), 0);
        process.onOutput = () -> seen.add(registry.get(task.getId()).orElseThrow().runningAgent());
        when(launcher.launch(any(), any())).thenReturn(process);

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(seen).containsExactly(new AgentHandle("agent-1"));
    }

    @Test
    void run_nonZeroExit_failsAndStaysInProgress() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        when(launcher.launch(any(), any())).thenReturn(new FakeProcess("agent-1", List.of(), 2));

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(saved.getError()).isEqualTo("Agent exited with code 2");
        verify(tasks, never()).move(task.getId(), TaskStatus.REVIEW);
        assertThat(registry.get(task.getId())).isEmpty();
    }

    @Test
    void run_noWorkspace_failsWithoutLaunching() throws Exception {
        givenExecutionStore();
        when(workspaces.listWorkspaces(task.getId())).thenReturn(List.of());

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(saved.getError()).startsWith("No workspace for task");
        verifyNoInteractions(launcher);
    }

    @Test
    void run_launchFails_recordsError() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        when(launcher.launch(any(), any())).thenThrow(new IOException("claude: command not found"));

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(saved.getError()).isEqualTo("claude: command not found");
        assertThat(registry.get(task.getId())).isEmpty();
    }

    // ------------------------------------------------------------------
    // stopTask()
    // ------------------------------------------------------------------

    @Test
    void stopTask_beforeRunStarts_runNeverLaunches() {
        givenExecutionStore();
        when(executions.findFirstByTaskIdOrderByStartedAtDesc(task.getId())).thenAnswer(inv -> Optional.of(saved));

        scheduler.spawnForTask(task);
        scheduler.stopTask(task.getId());
        queued.get(0).run();

        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.KILLED);
        assertThat(saved.getError()).isEqualTo("Stopped by request");
        assertThat(registry.get(task.getId())).isEmpty();
        verifyNoInteractions(launcher);
    }

    @Test
    void stopTask_duringRun_killsProcessAndWorkerLeavesExecutionAlone() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        when(executions.findFirstByTaskIdOrderByStartedAtDesc(task.getId())).thenAnswer(inv -> Optional.of(saved));
        FakeProcess process = new FakeProcess("agent-1", List.of("working"), 143);
        process.onOutput = () -> scheduler.stopTask(task.getId());
        when(launcher.launch(any(), any())).thenReturn(process);

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(process.killed).isTrue();
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.KILLED);
        assertThat(saved.getError()).isEqualTo("Stopped by request");
        verify(tasks, never()).move(task.getId(), TaskStatus.REVIEW);
        assertThat(meterRegistry.counter("taskpilot.agent.runs", "outcome", "killed").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("taskpilot.agent.runs", "outcome", "failed").count()).isZero();
        assertThat(registry.get(task.getId())).isEmpty();
    }

    @Test
    void stopTask_processStillExiting_taskStaysRunningUntilWorkerSeesExit() throws Exception {
        givenExecutionStore();
        givenWorkspace();
        when(executions.findFirstByTaskIdOrderByStartedAtDesc(task.getId())).thenAnswer(inv -> Optional.of(saved));
        List<Boolean> runningAfterStop = new ArrayList<>();
        FakeProcess process = new FakeProcess("agent-1", List.of("still writing", "more"), 143);
        process.onOutput = () -> {
            if (!process.killed) scheduler.stopTask(task.getId());
            runningAfterStop.add(scheduler.isRunning(task.getId()));
        };
        when(launcher.launch(any(), any())).thenReturn(process);

        scheduler.spawnForTask(task);
        queued.get(0).run();

        assertThat(process.killed).isTrue();
        assertThat(runningAfterStop).containsExactly(true, true);
        assertThat(saved.getStatus()).isEqualTo(ExecutionStatus.KILLED);
        assertThat(scheduler.isRunning(task.getId())).isFalse();
    }

    @Test
    void stopTask_nothingRunning_isHarmless() {
        when(executions.findFirstByTaskIdOrderByStartedAtDesc(task.getId())).thenReturn(Optional.empty());

        scheduler.stopTask(task.getId());

        verify(executions, never()).save(any());
    }

    // ------------------------------------------------------------------
    // waitForRunningAgent()
    // ------------------------------------------------------------------

    @Test
    void waitForRunningAgent_attached_returnsTrue() throws Exception {
        registry.attachRunningAgent(task.getId(), new AgentHandle("agent-1"));

        assertThat(scheduler.waitForRunningAgent(task.getId(), Duration.ofMillis(10))).isTrue();
    }

    @Test
    void waitForRunningAgent_neverAttached_timesOut() throws Exception {
        registry.markStarted(task.getId());

        assertThat(scheduler.waitForRunningAgent(task.getId(), Duration.ofMillis(20))).isFalse();
    }

    @Test
    void mergeLock_isSharedAcrossCalls() {
        assertThat(scheduler.mergeLock()).isSameAs(scheduler.mergeLock());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** The first saved execution gets {@link #executionId}; findById returns it as it is now. */
    private void givenExecutionStore() {
        when(executions.save(any(Execution.class))).thenAnswer(inv -> {
            Execution e = inv.getArgument(0);
            if (e.getId() == null) {
                saved = TestEntities.withId(e, executionId);
            }
            return e;
        });
        lenient().when(executions.findById(executionId)).thenAnswer(inv -> Optional.ofNullable(saved));
    }

    private void givenWorkspace() {
        when(workspaces.listWorkspaces(task.getId())).thenReturn(
                List.of(new WorkspaceInfo("ws-1", task.getId().toString(), "taskpilot/fix-login", "/wt")));
    }

    static class FakeProcess implements AgentProcess {

        final String       id;
        final List<String> lines;
        final int          exitCode;
        Runnable onOutput = () -> {};
        boolean  killed;

        FakeProcess(String id, List<String> lines, int exitCode) {
            this.id       = id;
            this.lines    = lines;
            this.exitCode = exitCode;
        }

        @Override public String id() { return id; }

        @Override
        public void forEachOutputLine(Consumer<String> consumer) {
            for (String line : lines) {
                consumer.accept(line);
                onOutput.run();
            }
        }

        @Override public int waitFor() { return exitCode; }

        @Override public void kill() { killed = true; }
    }
}
