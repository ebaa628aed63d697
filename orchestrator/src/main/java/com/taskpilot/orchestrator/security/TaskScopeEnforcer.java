package com.taskpilot.orchestrator.security;

import com.taskpilot.orchestrator.model.Job;
import com.taskpilot.orchestrator.repository.JobRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.taskpilot.orchestrator.security.ProtocolCall.*;

/**
 * Keeps a {@code task:<id>} session on its own task.
 *
 * The tasks a request touches are its {@code task_id} parameter and the owner
 * of its {@code job_id}. Task-mutating calls must name at least one; every
 * task a call names must be the session's own.
 */
@Component
public class TaskScopeEnforcer {

    static final Set<ProtocolCall> TASK_SCOPED_CALLS = EnumSet.of(
            JOBS_SUBMIT, JOBS_GET, JOBS_WAIT, JOBS_EVENTS, JOBS_CANCEL,
            TASKS_UPDATE_SCRATCHPAD, TASKS_RECOVER_OUTPUT, TASKS_DELETE,
            REVIEW_REQUEST);

    private final JobRepository jobRepo;

    public TaskScopeEnforcer(JobRepository jobRepo) {
        this.jobRepo = jobRepo;
    }

    /**
     * @throws SessionBindingException INVALID_PARAMS when a task-scoped call names no task,
     *         SESSION_SCOPE_DENIED when it names another task
     */
    public void enforce(SessionBinding binding, String capability, String method, Map<String, Object> params) {
        if (!binding.isTaskScoped()) return;

        boolean scopedCall = ProtocolCall.find(capability, method)
                .map(TASK_SCOPED_CALLS::contains)
                .orElse(false);

        List<String> referenced = referencedTasks(binding, params);
        if (referenced.isEmpty()) {
            if (scopedCall) {
                throw new SessionBindingException(SessionBindingException.INVALID_PARAMS,
                        "Task-scoped session '" + binding.sessionId() + "' requires a non-empty task_id parameter");
            }
            return;
        }
        for (String taskId : referenced) {
            if (!taskId.equals(binding.scopeId())) {
                throw new SessionBindingException(SessionBindingException.SESSION_SCOPE_DENIED,
                        "Session '" + binding.sessionId() + "' is scoped to task '" + binding.scopeId()
                        + "' and cannot act on task '" + taskId + "'");
            }
        }
    }

    /** The {@code task_id} parameter and the owner of the {@code job_id} parameter, whichever are present. */
    private List<String> referencedTasks(SessionBinding binding, Map<String, Object> params) {
        List<String> referenced = new ArrayList<>(2);
        String taskId = stringParam(params, "task_id");
        if (taskId != null) referenced.add(taskId);

        String jobId = stringParam(params, "job_id");
        if (jobId == null) return referenced;

        UUID id;
        try {
            id = UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            throw new SessionBindingException(SessionBindingException.INVALID_PARAMS,
                    "job_id is not a valid id: " + jobId);
        }
        // An unknown job cannot be shown to belong to this session's task.
        String owner = jobRepo.findById(id)
                .map(Job::getTaskId)
                .map(UUID::toString)
                .orElseThrow(() -> new SessionBindingException(SessionBindingException.SESSION_SCOPE_DENIED,
                        "Session '" + binding.sessionId() + "' cannot access job '" + jobId + "'"));
        referenced.add(owner);
        return referenced;
    }

    private static String stringParam(Map<String, Object> params, String name) {
        if (params == null) return null;
        Object value = params.get(name);
        if (value == null) return null;
        String s = value.toString().strip();
        return s.isEmpty() ? null : s;
    }
}
