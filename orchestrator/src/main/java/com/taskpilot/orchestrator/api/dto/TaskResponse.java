package com.taskpilot.orchestrator.api.dto;

import com.taskpilot.orchestrator.model.Task;

import java.time.Instant;
import java.util.UUID;

/**
 * Task as returned by tasks.get, tasks.list and the task mutations.
 */
public record TaskResponse(
        UUID    id,
        String  title,
        String  description,
        String  status,
        String  task_type,
        String  base_branch,
        Instant created_at,
        Instant updated_at
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getTitle(),
                t.getDescription(),
                t.getStatus().name(),
                t.getTaskType().name(),
                t.getBaseBranch(),
                t.getCreatedAt(),
                t.getUpdatedAt()
        );
    }
}
