package com.taskpilot.orchestrator.security;

/**
 * Authorization context fixed for the lifetime of a session.
 *
 * @param scopeId the part of the session id after the namespace prefix;
 *                for TASK sessions, the id of the only task it may touch
 */
public record SessionBinding(
        String            sessionId,
        AuthorizationPolicy policy,
        SessionOrigin     origin,
        SessionNamespace  namespace,
        String            scopeId) {

    public CapabilityProfile profile() {
        return policy.profile();
    }

    public boolean isTaskScoped() {
        return namespace == SessionNamespace.TASK;
    }
}
