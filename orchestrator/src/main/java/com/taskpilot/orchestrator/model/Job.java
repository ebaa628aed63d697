package com.taskpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * An action requested against a task through the request API
 * (start or stop its agent).
 *
 * The owning task id is what task-scoped sessions are checked against
 * when a request only names the job.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Column(nullable = false)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.QUEUED;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Job() {}   // required by JPA

    public Job(UUID taskId, String action) {
        this.taskId = taskId;
        this.action = action;
    }

    public UUID      getId()        { return id; }
    public UUID      getTaskId()    { return taskId; }
    public String    getAction()    { return action; }
    public JobStatus getStatus()    { return status; }
    public String    getMessage()   { return message; }
    public Instant   getCreatedAt() { return createdAt; }
    public Instant   getUpdatedAt() { return updatedAt; }

    public void setStatus(JobStatus status)   { this.status = status; }
    public void setMessage(String message)    { this.message = message; }

    public boolean isTerminal() {
        return status == JobStatus.SUCCEEDED
            || status == JobStatus.FAILED
            || status == JobStatus.CANCELLED;
    }
}
