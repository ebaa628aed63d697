package com.taskpilot.orchestrator.security;

/**
 * Answers "may this profile make this call".
 *
 * <pre>
 *   policy = new AuthorizationPolicy(VIEWER)
 *   policy.check("tasks", "list")     → true
 *   policy.check("tasks", "delete")   → false
 *   policy.enforce("tasks", "delete") → AuthorizationException
 * </pre>
 */
public class AuthorizationPolicy {

    private final CapabilityProfile profile;

    public AuthorizationPolicy(CapabilityProfile profile) {
        this.profile = profile;
    }

    public CapabilityProfile profile() {
        return profile;
    }

    public boolean check(String capability, String method) {
        if (profile.isUnrestricted()) return true;
        return ProtocolCall.find(capability, method)
                .map(call -> profile.allowedCalls().contains(call))
                .orElse(false);
    }

    /**
     * @throws AuthorizationException when {@link #check} is false
     */
    public void enforce(String capability, String method) {
        if (!check(capability, method)) {
            throw new AuthorizationException(profile, capability, method);
        }
    }
}
