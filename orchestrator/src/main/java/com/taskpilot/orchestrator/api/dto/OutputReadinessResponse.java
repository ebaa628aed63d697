package com.taskpilot.orchestrator.api.dto;

import com.taskpilot.orchestrator.runtime.AutoOutputReadiness;

import java.util.UUID;

/**
 * Result of tasks.output. running_agent is the opaque agent id, never a process detail.
 */
public record OutputReadinessResponse(
        UUID    task_id,
        String  mode,
        boolean can_open_output,
        UUID    execution_id,
        String  running_agent,
        boolean is_running,
        String  message
) {
    public static OutputReadinessResponse from(UUID taskId, AutoOutputReadiness r) {
        return new OutputReadinessResponse(
                taskId,
                r.mode().name(),
                r.canOpenOutput(),
                r.executionId(),
                r.runningAgent() == null ? null : r.runningAgent().agentId(),
                r.isRunning(),
                r.message()
        );
    }
}
