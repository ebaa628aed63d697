package com.taskpilot.orchestrator.security;

/**
 * A bound profile is not allowed to make a call.
 */
public class AuthorizationException extends RuntimeException {

    public static final String CODE = "AUTHORIZATION_DENIED";

    private final CapabilityProfile profile;
    private final String capability;
    private final String method;

    public AuthorizationException(CapabilityProfile profile, String capability, String method) {
        super("Profile '" + profile.wireName() + "' is not authorized for " + capability + "." + method);
        this.profile    = profile;
        this.capability = capability;
        this.method     = method;
    }

    public String            getCode()       { return CODE; }
    public CapabilityProfile getProfile()    { return profile; }
    public String            getCapability() { return capability; }
    public String            getMethod()     { return method; }
}
