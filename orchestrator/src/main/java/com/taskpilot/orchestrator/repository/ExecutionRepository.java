package com.taskpilot.orchestrator.repository;

import com.taskpilot.orchestrator.model.Execution;
import com.taskpilot.orchestrator.model.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries over persisted agent runs.
 */
public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    Optional<Execution> findFirstByTaskIdOrderByStartedAtDesc(UUID taskId);

    long countByTaskId(UUID taskId);

    @Query("""
            SELECT e FROM Execution e
            WHERE e.taskId IN :taskIds
              AND e.status = :status
            ORDER BY e.startedAt DESC
            """)
    List<Execution> findByTaskIdInAndStatusNewestFirst(@Param("taskIds") Collection<UUID> taskIds,
                                                       @Param("status") ExecutionStatus status);

    /**
     * Latest RUNNING execution id per task, for the given tasks only.
     * Tasks with no RUNNING execution are absent from the map.
     */
    default Map<UUID, UUID> findLatestRunningExecutions(Collection<UUID> taskIds) {
        Map<UUID, UUID> latest = new LinkedHashMap<>();
        if (taskIds.isEmpty()) return latest;
        for (Execution e : findByTaskIdInAndStatusNewestFirst(taskIds, ExecutionStatus.RUNNING)) {
            latest.putIfAbsent(e.getTaskId(), e.getId());
        }
        return latest;
    }
}
