package com.taskpilot.orchestrator.security;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.taskpilot.orchestrator.security.ProtocolCall.*;

/**
 * Named permission bundles, ordered from least to most privileged.
 *
 * Each profile allows everything the previous one does plus its own additions.
 * MAINTAINER additionally allows every unregistered call.
 */
public enum CapabilityProfile {
    VIEWER,
    PLANNER,
    PAIR_WORKER,
    OPERATOR,
    MAINTAINER;

    public static final CapabilityProfile DEFAULT = VIEWER;

    private static final Map<CapabilityProfile, Set<ProtocolCall>> ALLOWED = new EnumMap<>(CapabilityProfile.class);

    static {
        EnumSet<ProtocolCall> calls = EnumSet.of(
                TASKS_CONTEXT, TASKS_GET, TASKS_LIST, TASKS_LOGS, TASKS_SCRATCHPAD, TASKS_OUTPUT,
                PROJECTS_GET, PROJECTS_LIST, PROJECTS_REPOS,
                AUDIT_LIST);
        ALLOWED.put(VIEWER, Collections.unmodifiableSet(EnumSet.copyOf(calls)));

        calls.add(PLAN_PROPOSE);
        ALLOWED.put(PLANNER, Collections.unmodifiableSet(EnumSet.copyOf(calls)));

        calls.addAll(EnumSet.of(
                TASKS_UPDATE_SCRATCHPAD, TASKS_RECOVER_OUTPUT,
                JOBS_SUBMIT, JOBS_GET, JOBS_WAIT, JOBS_EVENTS, JOBS_CANCEL,
                REVIEW_REQUEST,
                SESSIONS_CREATE, SESSIONS_ATTACH, SESSIONS_EXISTS, SESSIONS_KILL));
        ALLOWED.put(PAIR_WORKER, Collections.unmodifiableSet(EnumSet.copyOf(calls)));

        calls.addAll(EnumSet.of(
                TASKS_CREATE, TASKS_UPDATE, TASKS_MOVE,
                REVIEW_APPROVE, REVIEW_REJECT));
        ALLOWED.put(OPERATOR, Collections.unmodifiableSet(EnumSet.copyOf(calls)));

        calls.addAll(EnumSet.of(
                TASKS_DELETE, REVIEW_MERGE, REVIEW_REBASE,
                PROJECTS_CREATE, PROJECTS_OPEN,
                DIAGNOSTICS_INSTRUMENTATION,
                SETTINGS_GET, SETTINGS_UPDATE));
        ALLOWED.put(MAINTAINER, Collections.unmodifiableSet(EnumSet.copyOf(calls)));
    }

    public Set<ProtocolCall> allowedCalls() {
        return ALLOWED.get(this);
    }

    /** True when this profile may call an unregistered pair. */
    public boolean isUnrestricted() {
        return this == MAINTAINER;
    }

    public boolean outranks(CapabilityProfile other) {
        return compareTo(other) > 0;
    }

    /** Wire name, e.g. "pair_worker". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** The lower of this profile and the ceiling. */
    public CapabilityProfile cappedAt(CapabilityProfile ceiling) {
        return outranks(ceiling) ? ceiling : this;
    }

    /**
     * @throws IllegalArgumentException for an unknown profile name
     */
    public static CapabilityProfile parse(String value) {
        String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
        for (CapabilityProfile p : values()) {
            if (p.wireName().equals(normalized)) return p;
        }
        String valid = Arrays.stream(values()).map(CapabilityProfile::wireName).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
                "Unknown capability profile '" + value + "'. Valid profiles: " + valid);
    }
}
