package com.taskpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A unit of work on the board, worked on by one agent in its own worktree.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.BACKLOG;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false)
    private TaskType taskType = TaskType.AUTO;

    // Explicit merge target. Null means "use the workspace's target branch".
    @Column(name = "base_branch")
    private String baseBranch;

    // Free-form notes the agent keeps between runs.
    @Column(columnDefinition = "TEXT")
    private String scratchpad;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String title, TaskType taskType) {
        this.title    = title;
        this.taskType = taskType;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()          { return id; }
    public String     getTitle()       { return title; }
    public String     getDescription() { return description; }
    public TaskStatus getStatus()      { return status; }
    public TaskType   getTaskType()    { return taskType; }
    public String     getBaseBranch()  { return baseBranch; }
    public String     getScratchpad()  { return scratchpad; }
    public Instant    getCreatedAt()   { return createdAt; }
    public Instant    getUpdatedAt()   { return updatedAt; }

    public void setTitle(String title)              { this.title = title; }
    public void setDescription(String description)  { this.description = description; }
    public void setStatus(TaskStatus status)        { this.status = status; }
    public void setBaseBranch(String baseBranch)    { this.baseBranch = baseBranch; }
    public void setScratchpad(String scratchpad)    { this.scratchpad = scratchpad; }

    public boolean isAuto() { return taskType == TaskType.AUTO; }

    /** First eight characters of the id, used in commit messages and log lines. */
    public String shortId() {
        return id == null ? "unknown" : id.toString().substring(0, 8);
    }
}
