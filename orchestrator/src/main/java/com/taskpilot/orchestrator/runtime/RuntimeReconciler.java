package com.taskpilot.orchestrator.runtime;

import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.model.TaskType;
import com.taskpilot.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Periodically syncs the runtime registry with the executions table.
 *
 * Covers AUTO tasks on the IN_PROGRESS and REVIEW columns, plus every task the
 * registry currently reports as running, so entries for tasks that moved
 * elsewhere are also checked.
 */
@Component
@EnableScheduling
public class RuntimeReconciler {

    private static final Logger log = LoggerFactory.getLogger(RuntimeReconciler.class);

    private static final List<TaskStatus> ACTIVE_COLUMNS = List.of(TaskStatus.IN_PROGRESS, TaskStatus.REVIEW);

    private final TaskRepository  taskRepo;
    private final RuntimeRegistry registry;

    public RuntimeReconciler(TaskRepository taskRepo, RuntimeRegistry registry) {
        this.taskRepo = taskRepo;
        this.registry = registry;
    }

    @Scheduled(fixedDelayString = "${taskpilot.runtime.reconcile-interval-ms:5000}",
               initialDelayString = "${taskpilot.runtime.reconcile-interval-ms:5000}")
    public void tick() {
        Set<UUID> taskIds = new LinkedHashSet<>();
        try {
            taskRepo.findByTaskTypeAndStatusIn(TaskType.AUTO, ACTIVE_COLUMNS).stream()
                    .map(Task::getId)
                    .forEach(taskIds::add);
        } catch (DataAccessException e) {
            log.debug("Skipping reconcile tick, task query failed: {}", e.getMessage());
            return;
        }
        taskIds.addAll(registry.runningTasks());
        registry.reconcileRunningTasks(taskIds);
    }
}
