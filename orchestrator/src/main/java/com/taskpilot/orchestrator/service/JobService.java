package com.taskpilot.orchestrator.service;

import com.taskpilot.orchestrator.automation.AutomationService;
import com.taskpilot.orchestrator.model.Job;
import com.taskpilot.orchestrator.model.JobStatus;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Actions requested against a task through the request API.
 *
 * A job records the request and what came of it. The agent run a
 * {@code start_agent} job kicks off is tracked separately as an Execution.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    public static final String START_AGENT = "start_agent";
    public static final String STOP_AGENT  = "stop_agent";

    private final JobRepository     jobRepo;
    private final TaskService       tasks;
    private final AutomationService automation;

    public JobService(JobRepository jobRepo, TaskService tasks, AutomationService automation) {
        this.jobRepo    = jobRepo;
        this.tasks      = tasks;
        this.automation = automation;
    }

    /**
     * Record and carry out an action.
     *
     * @throws IllegalArgumentException for an unknown action or task
     */
    @Transactional
    public Job submit(UUID taskId, String action) {
        if (!START_AGENT.equals(action) && !STOP_AGENT.equals(action)) {
            throw new IllegalArgumentException(
                    "Unsupported job action '" + action + "'. Expected " + START_AGENT + " or " + STOP_AGENT);
        }
        Task task = tasks.require(taskId);
        Job job = jobRepo.save(new Job(taskId, action));
        job.setStatus(JobStatus.RUNNING);

        try {
            if (START_AGENT.equals(action)) {
                if (automation.spawnForTask(task)) {
                    complete(job, JobStatus.SUCCEEDED, "Agent run queued");
                } else {
                    complete(job, JobStatus.FAILED,
                            task.isAuto() ? "Agent is already running" : "Only AUTO tasks run agents");
                }
            } else {
                automation.stopTask(taskId);
                complete(job, JobStatus.SUCCEEDED, "Agent stopped");
            }
        } catch (RuntimeException e) {
            log.error("Job {} ({}) for task {} failed: {}", job.getId(), action, taskId, e.getMessage(), e);
            complete(job, JobStatus.FAILED, e.getMessage());
        }
        log.info("Job {} {} for task {} → {}", job.getId(), action, task.shortId(), job.getStatus());
        return jobRepo.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<Job> findById(UUID id) {
        return jobRepo.findById(id);
    }

    /**
     * Cancel a job that has not finished. A finished job is returned unchanged.
     *
     * @throws IllegalArgumentException if no job has this id
     */
    @Transactional
    public Job cancel(UUID id) {
        Job job = jobRepo.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + id));
        if (job.isTerminal()) {
            return job;
        }
        complete(job, JobStatus.CANCELLED, "Cancelled by request");
        log.info("Job {} cancelled", id);
        return jobRepo.save(job);
    }

    private static void complete(Job job, JobStatus status, String message) {
        job.setStatus(status);
        job.setMessage(message);
    }
}
