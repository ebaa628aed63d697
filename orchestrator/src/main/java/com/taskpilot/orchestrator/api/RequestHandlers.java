package com.taskpilot.orchestrator.api;

import com.taskpilot.orchestrator.api.dto.AuditEventResponse;
import com.taskpilot.orchestrator.api.dto.JobResponse;
import com.taskpilot.orchestrator.api.dto.OutputReadinessResponse;
import com.taskpilot.orchestrator.api.dto.TaskResponse;
import com.taskpilot.orchestrator.automation.AutomationService;
import com.taskpilot.orchestrator.merge.MergeCoordinator;
import com.taskpilot.orchestrator.merge.MergeOutcome;
import com.taskpilot.orchestrator.model.Execution;
import com.taskpilot.orchestrator.model.ExecutionLog;
import com.taskpilot.orchestrator.model.Task;
import com.taskpilot.orchestrator.model.TaskStatus;
import com.taskpilot.orchestrator.model.TaskType;
import com.taskpilot.orchestrator.repository.AuditEventRepository;
import com.taskpilot.orchestrator.repository.ExecutionLogRepository;
import com.taskpilot.orchestrator.repository.ExecutionRepository;
import com.taskpilot.orchestrator.runtime.AutoOutputCoordinator;
import com.taskpilot.orchestrator.runtime.AutoOutputRecoveryResult;
import com.taskpilot.orchestrator.security.ProtocolCall;
import com.taskpilot.orchestrator.service.JobService;
import com.taskpilot.orchestrator.service.TaskService;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The built-in handler for each supported (capability, method) pair.
 *
 * Registered pairs without a handler here (projects.*, plan.propose, ...)
 * are answered with UNKNOWN_METHOD by the dispatcher.
 */
@Component
public class RequestHandlers {

    static final int DEFAULT_AUDIT_LIMIT = 50;
    static final int MAX_AUDIT_LIMIT     = 500;

    private final TaskService            tasks;
    private final JobService             jobs;
    private final AutoOutputCoordinator  output;
    private final MergeCoordinator       merges;
    private final AutomationService      automation;
    private final ExecutionRepository    executions;
    private final ExecutionLogRepository executionLogs;
    private final AuditEventRepository   auditRepo;

    private final Map<ProtocolCall, RequestHandler> handlers = new EnumMap<>(ProtocolCall.class);

    public RequestHandlers(TaskService tasks,
                           JobService jobs,
                           AutoOutputCoordinator output,
                           MergeCoordinator merges,
                           AutomationService automation,
                           ExecutionRepository executions,
                           ExecutionLogRepository executionLogs,
                           AuditEventRepository auditRepo) {
        this.tasks         = tasks;
        this.jobs          = jobs;
        this.output        = output;
        this.merges        = merges;
        this.automation    = automation;
        this.executions    = executions;
        this.executionLogs = executionLogs;
        this.auditRepo     = auditRepo;
        registerAll();
    }

    public Optional<RequestHandler> find(ProtocolCall call) {
        return Optional.ofNullable(handlers.get(call));
    }

    public Set<ProtocolCall> handledCalls() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    private void registerAll() {
        // ── tasks ────────────────────────────────────────────────────────────
        handlers.put(ProtocolCall.TASKS_GET, p -> TaskResponse.from(task(p)));
        handlers.put(ProtocolCall.TASKS_LIST, p -> tasks.list(p.optEnum("status", TaskStatus.class)).stream()
                .map(TaskResponse::from)
                .toList());
        handlers.put(ProtocolCall.TASKS_SCRATCHPAD, p -> {
            Task task = task(p);
            return scratchpad(task.getId(), task.getScratchpad());
        });
        handlers.put(ProtocolCall.TASKS_LOGS, this::logs);
        handlers.put(ProtocolCall.TASKS_OUTPUT, p -> {
            Task task = task(p);
            return OutputReadinessResponse.from(task.getId(), output.prepareOutput(task));
        });
        handlers.put(ProtocolCall.TASKS_RECOVER_OUTPUT, p -> {
            AutoOutputRecoveryResult result = output.recoverStaleOutput(task(p));
            return outcome(result.success(), result.message());
        });
        handlers.put(ProtocolCall.TASKS_UPDATE_SCRATCHPAD, p -> {
            String content = p.rawString("content");
            if (content == null) throw new IllegalArgumentException("Missing required parameter: content");
            Task task = tasks.updateScratchpad(p.requireUuid("task_id"), content);
            return scratchpad(task.getId(), task.getScratchpad());
        });
        handlers.put(ProtocolCall.TASKS_CREATE, p -> TaskResponse.from(tasks.create(
                p.requireString("title"),
                p.optString("description"),
                p.optEnum("task_type", TaskType.class),
                p.optString("base_branch"))));
        handlers.put(ProtocolCall.TASKS_UPDATE, p -> TaskResponse.from(tasks.updateFields(
                p.requireUuid("task_id"),
                p.optString("title"),
                p.rawString("description"),
                p.rawString("base_branch"))));
        handlers.put(ProtocolCall.TASKS_MOVE, p -> TaskResponse.from(
                tasks.move(p.requireUuid("task_id"), p.requireEnum("status", TaskStatus.class))));
        handlers.put(ProtocolCall.TASKS_DELETE, p -> {
            UUID taskId = task(p).getId();
            if (automation.isRunning(taskId)) {
                automation.stopTask(taskId);
            }
            tasks.delete(taskId);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("task_id", taskId);
            result.put("deleted", true);
            return result;
        });

        // ── jobs ─────────────────────────────────────────────────────────────
        handlers.put(ProtocolCall.JOBS_SUBMIT, p -> JobResponse.from(
                jobs.submit(p.requireUuid("task_id"), p.requireString("action"))));
        handlers.put(ProtocolCall.JOBS_GET, p -> {
            UUID jobId = p.requireUuid("job_id");
            return jobs.findById(jobId)
                    .map(JobResponse::from)
                    .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
        });
        handlers.put(ProtocolCall.JOBS_CANCEL, p -> JobResponse.from(jobs.cancel(p.requireUuid("job_id"))));

        // ── review ───────────────────────────────────────────────────────────
        handlers.put(ProtocolCall.REVIEW_REQUEST, p -> TaskResponse.from(
                tasks.move(p.requireUuid("task_id"), TaskStatus.REVIEW)));
        handlers.put(ProtocolCall.REVIEW_APPROVE, p -> {
            Task task = task(p);
            MergeOutcome result = merges.hasNoChanges(task)
                    ? merges.closeExploratory(task)
                    : merges.mergeTask(task);
            return outcome(result.success(), result.message());
        });
        handlers.put(ProtocolCall.REVIEW_REJECT, p -> {
            String action = Optional.ofNullable(p.optString("action")).orElse("return");
            if (!action.equals("return") && !action.equals("backlog")) {
                throw new IllegalArgumentException("Invalid action: " + action + ". Expected return or backlog");
            }
            return TaskResponse.from(merges.applyRejectionFeedback(task(p), p.optString("feedback"), action));
        });
        handlers.put(ProtocolCall.REVIEW_MERGE, p -> {
            MergeOutcome result = merges.mergeTask(task(p));
            return outcome(result.success(), result.message());
        });
        handlers.put(ProtocolCall.REVIEW_REBASE, p -> {
            MergeOutcome result = merges.rebaseTask(task(p));
            return outcome(result.success(), result.message());
        });

        // ── audit ────────────────────────────────────────────────────────────
        handlers.put(ProtocolCall.AUDIT_LIST, p -> {
            int limit = Math.max(1, Math.min(p.optInt("limit", DEFAULT_AUDIT_LIMIT), MAX_AUDIT_LIMIT));
            return auditRepo.findAllByOrderByOccurredAtDesc(PageRequest.of(0, limit)).stream()
                    .map(AuditEventResponse::from)
                    .toList();
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task task(RequestParams p) {
        return tasks.require(p.requireUuid("task_id"));
    }

    /** Output chunks of the task's latest execution, oldest first. */
    private Object logs(RequestParams p) {
        Task task = task(p);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_id", task.getId());
        Optional<Execution> latest = executions.findFirstByTaskIdOrderByStartedAtDesc(task.getId());
        result.put("execution_id", latest.map(Execution::getId).orElse(null));
        result.put("status", latest.map(e -> e.getStatus().name()).orElse(null));
        List<String> chunks = latest
                .map(e -> executionLogs.findByExecutionIdOrderByCreatedAtAsc(e.getId()).stream()
                        .map(ExecutionLog::getLogs)
                        .toList())
                .orElse(List.of());
        result.put("logs", chunks);
        return result;
    }

    private static Map<String, Object> scratchpad(UUID taskId, String content) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_id", taskId);
        result.put("content", content == null ? "" : content);
        return result;
    }

    private static Map<String, Object> outcome(boolean success, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("message", message);
        return result;
    }
}
