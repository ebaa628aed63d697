package com.taskpilot.orchestrator.security;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every (capability, method) pair known to the authorization layer.
 *
 * A pair missing from this enum is "unregistered": only MAINTAINER may call it.
 */
public enum ProtocolCall {

    TASKS_CONTEXT          ("tasks", "context"),
    TASKS_GET              ("tasks", "get"),
    TASKS_LIST             ("tasks", "list"),
    TASKS_LOGS             ("tasks", "logs"),
    TASKS_SCRATCHPAD       ("tasks", "scratchpad"),
    TASKS_OUTPUT           ("tasks", "output"),
    TASKS_UPDATE_SCRATCHPAD("tasks", "update_scratchpad"),
    TASKS_RECOVER_OUTPUT   ("tasks", "recover_output"),
    TASKS_CREATE           ("tasks", "create"),
    TASKS_UPDATE           ("tasks", "update"),
    TASKS_MOVE             ("tasks", "move"),
    TASKS_DELETE           ("tasks", "delete"),

    PROJECTS_GET           ("projects", "get"),
    PROJECTS_LIST          ("projects", "list"),
    PROJECTS_REPOS         ("projects", "repos"),
    PROJECTS_CREATE        ("projects", "create"),
    PROJECTS_OPEN          ("projects", "open"),

    AUDIT_LIST             ("audit", "list"),

    PLAN_PROPOSE           ("plan", "propose"),

    JOBS_SUBMIT            ("jobs", "submit"),
    JOBS_GET               ("jobs", "get"),
    JOBS_WAIT              ("jobs", "wait"),
    JOBS_EVENTS            ("jobs", "events"),
    JOBS_CANCEL            ("jobs", "cancel"),

    REVIEW_REQUEST         ("review", "request"),
    REVIEW_APPROVE         ("review", "approve"),
    REVIEW_REJECT          ("review", "reject"),
    REVIEW_MERGE           ("review", "merge"),
    REVIEW_REBASE          ("review", "rebase"),

    SESSIONS_CREATE        ("sessions", "create"),
    SESSIONS_ATTACH        ("sessions", "attach"),
    SESSIONS_EXISTS        ("sessions", "exists"),
    SESSIONS_KILL          ("sessions", "kill"),

    DIAGNOSTICS_INSTRUMENTATION("diagnostics", "instrumentation"),

    SETTINGS_GET           ("settings", "get"),
    SETTINGS_UPDATE        ("settings", "update");

    private static final Map<String, ProtocolCall> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ProtocolCall::key, Function.identity()));

    private final String capability;
    private final String method;

    ProtocolCall(String capability, String method) {
        this.capability = capability;
        this.method     = method;
    }

    public String capability() { return capability; }
    public String method()     { return method; }

    /** "capability.method" */
    public String key() {
        return key(capability, method);
    }

    public static Optional<ProtocolCall> find(String capability, String method) {
        return Optional.ofNullable(BY_KEY.get(key(capability, method)));
    }

    static String key(String capability, String method) {
        return capability + "." + method;
    }
}
