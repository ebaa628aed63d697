package com.taskpilot.orchestrator.repository;

import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.model.TaskType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + board queries for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    List<Task> findAllByOrderByCreatedAtAsc();

    List<Task> findByStatusOrderByCreatedAtAsc(TaskStatus status);

    /** Tasks whose runtime state the reconciler keeps in sync. */
    List<Task> findByTaskTypeAndStatusIn(TaskType taskType, Collection<TaskStatus> statuses);
}
