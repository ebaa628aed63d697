package com.taskpilot.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskpilot.orchestrator.executor.dto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client for the workspace executor service.
 *
 * The executor owns every git worktree and runs all git / gh commands on
 * the orchestrator's behalf. This class is the orchestrator's only view of
 * git: workspaces, diffs against the base branch, rebases and merges.
 *
 * Blocking I/O. Called from request threads and worker threads, never from
 * inside a registry lock.
 */
@Component
public class WorkspaceClient {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    private static final TypeReference<List<WorkspaceInfo>> WORKSPACE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<WorkspaceRepo>> REPO_LIST      = new TypeReference<>() {};
    private static final TypeReference<List<String>>        STRING_LIST    = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public WorkspaceClient(
            @Value("${taskpilot.executor.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Workspaces
    // ------------------------------------------------------------------

    /** Workspaces for a task, newest first. */
    public List<WorkspaceInfo> listWorkspaces(UUID taskId) {
        String body = get("/workspaces?task_id=" + taskId, "listWorkspaces for task " + taskId);
        return parse(body, WORKSPACE_LIST, "listWorkspaces");
    }

    public WorkspaceInfo getWorkspace(String workspaceId) {
        String body = get("/workspaces/" + workspaceId, "getWorkspace " + workspaceId);
        return parse(body, WorkspaceInfo.class, "getWorkspace");
    }

    public List<WorkspaceRepo> getWorkspaceRepos(String workspaceId) {
        String body = get("/workspaces/" + workspaceId + "/repos", "getWorkspaceRepos for " + workspaceId);
        return parse(body, REPO_LIST, "getWorkspaceRepos");
    }

    /**
     * Hand a workspace back to the executor.
     *
     * @param cleanup false keeps the worktree on disk (used after a merge so the
     *                branch can still be inspected)
     */
    public void release(String workspaceId, boolean cleanup, String reason) {
        log.info("Releasing workspace '{}' (cleanup={}, reason={})", workspaceId, cleanup, reason);
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("cleanup", cleanup);
        req.put("reason",  reason);
        post("/workspaces/" + workspaceId + "/release", toJson(req), "release for " + workspaceId);
    }

    // ------------------------------------------------------------------
    // Diffs against the base branch
    // ------------------------------------------------------------------

    /** Commits on the task branch that are not on the base branch. */
    public List<String> commitLog(UUID taskId, String baseBranch) {
        String body = get("/tasks/" + taskId + "/commits?base=" + encode(baseBranch),
                "commitLog for task " + taskId);
        return parse(body, STRING_LIST, "commitLog");
    }

    /**
     * Files the task branch changed since it diverged from base.
     * Paths are prefixed with the repo name, so the same path in two repos
     * of a workspace stays distinct.
     */
    public List<String> filesChanged(UUID taskId, String baseBranch) {
        String body = get("/tasks/" + taskId + "/changed-files?base=" + encode(baseBranch),
                "filesChanged for task " + taskId);
        return parse(body, STRING_LIST, "filesChanged");
    }

    /** Files changed on base since the task branch diverged from it. Same path format as {@link #filesChanged}. */
    public List<String> filesChangedOnBase(UUID taskId, String baseBranch) {
        String body = get("/tasks/" + taskId + "/base-changed-files?base=" + encode(baseBranch),
                "filesChangedOnBase for task " + taskId);
        return parse(body, STRING_LIST, "filesChangedOnBase");
    }

    // ------------------------------------------------------------------
    // Rebase
    // ------------------------------------------------------------------

    public RebaseResult rebaseOntoBase(UUID taskId, String baseBranch) {
        log.info("Rebasing task {} onto '{}'", taskId, baseBranch);
        String respBody = post("/tasks/" + taskId + "/rebase",
                toJson(Map.of("base_branch", baseBranch)),
                "rebaseOntoBase for task " + taskId,
                Duration.ofSeconds(300));
        return parse(respBody, RebaseResult.class, "rebaseOntoBase");
    }

    public void abortRebase(UUID taskId) {
        post("/tasks/" + taskId + "/rebase/abort", "{}", "abortRebase for task " + taskId);
    }

    // ------------------------------------------------------------------
    // Git operations on a single checkout
    // ------------------------------------------------------------------

    public boolean hasUncommittedChanges(String worktreePath) {
        String respBody = post("/git/status", toJson(Map.of("path", worktreePath)),
                "hasUncommittedChanges for " + worktreePath);
        return parse(respBody, GitStatusResponse.class, "hasUncommittedChanges").uncommitted();
    }

    public void commitAll(String worktreePath, String message) {
        post("/git/commit", toJson(Map.of("path", worktreePath, "message", message)),
                "commitAll for " + worktreePath);
    }

    public void push(String worktreePath, String branch) {
        post("/git/push", toJson(Map.of("path", worktreePath, "branch", branch)),
                "push " + branch, Duration.ofSeconds(300));
    }

    /**
     * Squash-merge source into target inside the main checkout.
     * A refused merge (conflicts, rebase required) comes back as success=false,
     * not as an exception.
     */
    public SquashMergeResult squashMerge(String repoPath, String sourceBranch,
                                         String targetBranch, String commitMessage) {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("repo_path",      repoPath);
        req.put("source_branch",  sourceBranch);
        req.put("target_branch",  targetBranch);
        req.put("commit_message", commitMessage);
        String respBody = post("/git/squash-merge", toJson(req),
                "squashMerge " + sourceBranch + " → " + targetBranch,
                Duration.ofSeconds(300));
        return parse(respBody, SquashMergeResult.class, "squashMerge");
    }

    /** Open a pull request; returns its URL. */
    public String createPullRequest(String repoPath, String headBranch, String baseBranch,
                                    String title, String body) {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("repo_path", repoPath);
        req.put("head",      headBranch);
        req.put("base",      baseBranch);
        req.put("title",     title);
        req.put("body",      body);
        String respBody = post("/git/pull-request", toJson(req), "createPullRequest for " + headBranch);
        return parse(respBody, PullRequestResponse.class, "createPullRequest").url();
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    /** Kill the terminal session attached to a task, if any. */
    public void terminateSession(UUID taskId) {
        send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/sessions/" + taskId))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .DELETE()
                .build(), "terminateSession for task " + taskId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String get(String path, String opName) {
        return send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(60))
                .header("Accept", "application/json")
                .GET()
                .build(), opName);
    }

    /** POST with default 120-second timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName) {
        return post(path, jsonBody, opName, Duration.ofSeconds(120));
    }

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        return send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build(), opName);
    }

    private String send(HttpRequest req, String opName) {
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        }
    }

    private <T> T parse(String body, TypeReference<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse " + opName + " response", e);
        }
    }

    /** Serialize obj to JSON string; throws ExecutorException on failure. */
    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
