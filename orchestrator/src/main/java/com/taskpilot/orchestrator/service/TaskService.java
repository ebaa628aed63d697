package com.taskpilot.orchestrator.service;

import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.model.TaskType;
import com.taskpilot.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Task store operations used by the request handlers, the merge coordinator
 * and the automation layer.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepo;

    public TaskService(TaskRepository taskRepo) {
        this.taskRepo = taskRepo;
    }

    @Transactional(readOnly = true)
    public Optional<Task> findById(UUID id) {
        return taskRepo.findById(id);
    }

    /**
     * @throws IllegalArgumentException if no task has this id
     */
    @Transactional(readOnly = true)
    public Task require(UUID id) {
        return taskRepo.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + id));
    }

    /** All tasks, or only those in the given column when status is non-null. */
    @Transactional(readOnly = true)
    public List<Task> list(TaskStatus status) {
        return status == null
                ? taskRepo.findAllByOrderByCreatedAtAsc()
                : taskRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional
    public Task create(String title, String description, TaskType type, String baseBranch) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        Task task = new Task(title.strip(), type == null ? TaskType.AUTO : type);
        task.setDescription(description);
        task.setBaseBranch(blankToNull(baseBranch));
        Task saved = taskRepo.save(task);
        log.info("Created {} task {} '{}'", saved.getTaskType(), saved.getId(), saved.getTitle());
        return saved;
    }

    /** Update the given fields; null arguments leave the field unchanged. */
    @Transactional
    public Task updateFields(UUID id, String title, String description, String baseBranch) {
        Task task = require(id);
        if (title != null && !title.isBlank()) task.setTitle(title.strip());
        if (description != null)               task.setDescription(description);
        if (baseBranch != null)                task.setBaseBranch(blankToNull(baseBranch));
        return taskRepo.save(task);
    }

    @Transactional
    public Task move(UUID id, TaskStatus status) {
        Task task = require(id);
        if (task.getStatus() != status) {
            log.info("Task {} {} → {}", task.shortId(), task.getStatus(), status);
            task.setStatus(status);
        }
        return taskRepo.save(task);
    }

    @Transactional
    public Task updateScratchpad(UUID id, String content) {
        Task task = require(id);
        task.setScratchpad(content);
        return taskRepo.save(task);
    }

    @Transactional
    public void delete(UUID id) {
        Task task = require(id);
        taskRepo.delete(task);
        log.info("Deleted task {}", id);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
