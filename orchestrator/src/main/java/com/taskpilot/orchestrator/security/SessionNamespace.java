package com.taskpilot.orchestrator.security;

import java.util.Locale;

/**
 * Prefix of a session id. {@code task:<id>} sessions are additionally scoped to one task.
 */
public enum SessionNamespace {
    DEFAULT,
    TASK,
    PLANNER,
    EXT,
    TUI;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Split a session id into namespace and scope id.
     * "task:abc" → (TASK, "abc"); anything without a known prefix → (DEFAULT, whole id).
     */
    static Scope parse(String sessionId) {
        int colon = sessionId.indexOf(':');
        if (colon > 0 && colon < sessionId.length() - 1) {
            String prefix = sessionId.substring(0, colon);
            for (SessionNamespace ns : values()) {
                if (ns != DEFAULT && ns.wireName().equals(prefix)) {
                    return new Scope(ns, sessionId.substring(colon + 1));
                }
            }
        }
        return new Scope(DEFAULT, sessionId);
    }

    record Scope(SessionNamespace namespace, String scopeId) {}
}
