package com.taskpilot.orchestrator.runtime;

import com.taskpilot.orchestrator.repository.ExecutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuntimeRegistryTest {

    static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock ExecutionRepository executions;

    RuntimeRegistry registry;
    UUID taskId;

    @BeforeEach
    void setUp() {
        registry = new RuntimeRegistry(executions, Clock.fixed(NOW, ZoneOffset.UTC));
        taskId   = UUID.randomUUID();
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @Test
    void get_unknownTask_isEmpty() {
        assertThat(registry.get(taskId)).isEmpty();
        assertThat(registry.runningTasks()).isEmpty();
    }

    @Test
    void markStarted_thenSetExecution_isRunningWithExecution() {
        UUID executionId = UUID.randomUUID();
        registry.markStarted(taskId);
        registry.setExecution(taskId, executionId, 3);

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.phase()).isEqualTo(RuntimeTaskPhase.RUNNING);
        assertThat(view.executionId()).isEqualTo(executionId);
        assertThat(view.runCount()).isEqualTo(3);
        assertThat(registry.runningTasks()).containsExactly(taskId);
    }

    @Test
    void markEnded_evictsEntry() {
        registry.markStarted(taskId);
        registry.attachRunningAgent(taskId, new AgentHandle("agent-1"));

        registry.markEnded(taskId);

        assertThat(registry.get(taskId)).isEmpty();
    }

    @Test
    void snapshot_doesNotChangeAfterLaterMutation() {
        registry.markStarted(taskId);
        RuntimeTaskView before = registry.get(taskId).orElseThrow();

        registry.attachRunningAgent(taskId, new AgentHandle("agent-1"));

        assertThat(before.runningAgent()).isNull();
        assertThat(registry.get(taskId).orElseThrow().runningAgent()).isEqualTo(new AgentHandle("agent-1"));
    }

    @Test
    void attachReviewAgent_thenClear_returnsToRunningWhileRunningAgentAttached() {
        registry.attachRunningAgent(taskId, new AgentHandle("agent-1"));
        registry.attachReviewAgent(taskId, new AgentHandle("review-1"));
        assertThat(registry.get(taskId).orElseThrow().isReviewing()).isTrue();

        registry.clearReviewAgent(taskId);

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.phase()).isEqualTo(RuntimeTaskPhase.RUNNING);
        assertThat(view.reviewAgent()).isNull();
    }

    @Test
    void markBlocked_dropsAgentsAndIsNotRunning() {
        UUID blocker = UUID.randomUUID();
        registry.attachRunningAgent(taskId, new AgentHandle("agent-1"));
        registry.markPending(taskId, "waiting for slot");

        registry.markBlocked(taskId, "overlaps another task", List.of(blocker), List.of("src/App.java"));

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.isRunning()).isFalse();
        assertThat(view.hasLiveAgent()).isFalse();
        assertThat(view.isPending()).isFalse();
        assertThat(view.blockedReason()).isEqualTo("overlaps another task");
        assertThat(view.blockedByTaskIds()).containsExactly(blocker);
        assertThat(view.overlapHints()).containsExactly("src/App.java");
        assertThat(view.blockedAt()).isEqualTo(NOW);
    }

    @Test
    void clearBlocked_evictsIdleEntry() {
        registry.markBlocked(taskId, "blocked", List.of(), List.of());

        registry.clearBlocked(taskId);

        assertThat(registry.get(taskId)).isEmpty();
    }

    @Test
    void markPending_whileRunning_keepsRunningPhase() {
        registry.markStarted(taskId);

        registry.markPending(taskId, "queued behind merge");

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.isRunning()).isTrue();
        assertThat(view.pendingReason()).isEqualTo("queued behind merge");
        assertThat(view.pendingAt()).isEqualTo(NOW);
    }

    @Test
    void clearPending_onIdleEntry_evicts() {
        registry.markPending(taskId, "queued");

        registry.clearPending(taskId);

        assertThat(registry.get(taskId)).isEmpty();
    }

    // ------------------------------------------------------------------
    // reconcileRunningTasks()
    // ------------------------------------------------------------------

    @Test
    void reconcile_persistedRunningExecution_recoversRunningEntry() {
        UUID executionId = UUID.randomUUID();
        when(executions.findLatestRunningExecutions(any())).thenReturn(Map.of(taskId, executionId));

        registry.reconcileRunningTasks(List.of(taskId));

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.phase()).isEqualTo(RuntimeTaskPhase.RUNNING);
        assertThat(view.executionId()).isEqualTo(executionId);
        assertThat(view.runningAgent()).isNull();
    }

    @Test
    void reconcile_twiceWithSameState_isIdempotent() {
        UUID running = UUID.randomUUID();
        UUID stale   = UUID.randomUUID();
        registry.markStarted(stale);
        when(executions.findLatestRunningExecutions(any())).thenReturn(Map.of(running, UUID.randomUUID()));

        registry.reconcileRunningTasks(List.of(running, stale));
        Map<UUID, RuntimeTaskView> first = registry.snapshotAll();
        registry.reconcileRunningTasks(List.of(running, stale));

        assertThat(registry.snapshotAll()).isEqualTo(first);
        assertThat(first).containsOnlyKeys(running);
    }

    @Test
    void reconcile_runningEntryWithoutPersistedExecution_isEvicted() {
        registry.markStarted(taskId);
        when(executions.findLatestRunningExecutions(any())).thenReturn(Map.of());

        registry.reconcileRunningTasks(Set.of(taskId));

        assertThat(registry.get(taskId)).isEmpty();
    }

    @Test
    void reconcile_entryWithLiveAgent_isKept() {
        registry.attachRunningAgent(taskId, new AgentHandle("agent-1"));
        when(executions.findLatestRunningExecutions(any())).thenReturn(Map.of());

        registry.reconcileRunningTasks(Set.of(taskId));

        assertThat(registry.get(taskId)).isPresent();
    }

    @Test
    void reconcile_blockedEntry_isNotMarkedRunning() {
        registry.markBlocked(taskId, "blocked", List.of(), List.of());
        when(executions.findLatestRunningExecutions(any())).thenReturn(Map.of(taskId, UUID.randomUUID()));

        registry.reconcileRunningTasks(Set.of(taskId));

        RuntimeTaskView view = registry.get(taskId).orElseThrow();
        assertThat(view.isRunning()).isFalse();
        assertThat(view.executionId()).isNull();
    }

    @Test
    void reconcile_databaseError_skipsCycle() {
        registry.markStarted(taskId);
        when(executions.findLatestRunningExecutions(any()))
                .thenThrow(new DataAccessResourceFailureException("connection closed"));

        registry.reconcileRunningTasks(Set.of(taskId));

        assertThat(registry.get(taskId)).isPresent();
    }

    @Test
    void reconcile_noIds_doesNotQuery() {
        registry.reconcileRunningTasks(List.of());

        verifyNoInteractions(executions);
    }
}
