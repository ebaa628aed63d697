package com.taskpilot.orchestrator.runtime;

/**
 * Opaque token naming a live agent owned by the automation layer.
 *
 * The registry only stores and clears these; it never resolves them to a
 * process and never asks whether the agent is still alive.
 */
public record AgentHandle(String agentId) {

    public AgentHandle {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
    }
}
