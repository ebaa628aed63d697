package com.taskpilot.orchestrator.events;

import java.time.Instant;

public record PRCreated(String workspaceId, String repoId, String prUrl, Instant occurredAt) {

    public PRCreated(String workspaceId, String repoId, String prUrl) {
        this(workspaceId, repoId, prUrl, Instant.now());
    }
}
