package com.taskpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One agent run for a task.
 *
 * A row stays RUNNING until the worker that owns the run records its exit.
 * If the host dies first the row is left RUNNING with no live process behind
 * it; AutoOutputCoordinator detects and recovers those.
 *
 * DB table: executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "executions")
public class Execution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "run_count", nullable = false)
    private int runCount;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(columnDefinition = "TEXT")
    private String error;

    protected Execution() {}   // required by JPA

    public Execution(UUID taskId, int runCount) {
        this.taskId   = taskId;
        this.runCount = runCount;
    }

    public UUID            getId()          { return id; }
    public UUID            getTaskId()      { return taskId; }
    public ExecutionStatus getStatus()      { return status; }
    public int             getRunCount()    { return runCount; }
    public Instant         getStartedAt()   { return startedAt; }
    public Instant         getCompletedAt() { return completedAt; }
    public String          getError()       { return error; }

    public void setStatus(ExecutionStatus status) { this.status = status; }
    public void setCompletedAt(Instant t)         { this.completedAt = t; }
    public void setError(String error)            { this.error = error; }

    public boolean isRunning() { return status == ExecutionStatus.RUNNING; }
}
