package com.taskpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A chunk of agent output captured for an execution.
 * Replayed to the UI when the live stream is gone (backfill).
 *
 * DB table: execution_logs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_logs")
public class ExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Column(columnDefinition = "TEXT")
    private String logs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ExecutionLog() {}   // required by JPA

    public ExecutionLog(UUID executionId, String logs) {
        this.executionId = executionId;
        this.logs        = logs;
    }

    public UUID    getId()          { return id; }
    public UUID    getExecutionId() { return executionId; }
    public String  getLogs()        { return logs; }
    public Instant getCreatedAt()   { return createdAt; }

    public boolean hasContent() { return logs != null && !logs.isBlank(); }
}
