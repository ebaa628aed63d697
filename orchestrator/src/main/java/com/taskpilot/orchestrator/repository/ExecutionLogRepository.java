package com.taskpilot.orchestrator.repository;

import com.taskpilot.orchestrator.model.ExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ExecutionLogRepository extends JpaRepository<ExecutionLog, UUID> {

    /** All output chunks for an execution, oldest first. */
    List<ExecutionLog> findByExecutionIdOrderByCreatedAtAsc(UUID executionId);

    /** True when at least one chunk of the execution carries non-blank output. */
    default boolean hasContent(UUID executionId) {
        return findByExecutionIdOrderByCreatedAtAsc(executionId).stream()
                .anyMatch(ExecutionLog::hasContent);
    }
}
