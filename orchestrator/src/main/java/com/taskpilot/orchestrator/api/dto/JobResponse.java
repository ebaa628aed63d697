package com.taskpilot.orchestrator.api.dto;

import com.taskpilot.orchestrator.model.Job;

import java.time.Instant;
import java.util.UUID;

public record JobResponse(
        UUID    job_id,
        UUID    task_id,
        String  action,
        String  status,
        String  message,
        Instant created_at,
        Instant updated_at
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getTaskId(),
                job.getAction(),
                job.getStatus().name(),
                job.getMessage(),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
