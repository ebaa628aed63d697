package com.taskpilot.orchestrator.security;

/**
 * A request breaks a session's binding: wrong profile, origin, namespace or task scope.
 */
public class SessionBindingException extends RuntimeException {

    public static final String INVALID_PROFILE          = "INVALID_PROFILE";
    public static final String INVALID_ORIGIN           = "INVALID_ORIGIN";
    public static final String SESSION_ORIGIN_MISMATCH  = "SESSION_ORIGIN_MISMATCH";
    public static final String SESSION_NAMESPACE_DENIED = "SESSION_NAMESPACE_DENIED";
    public static final String SESSION_SCOPE_DENIED     = "SESSION_SCOPE_DENIED";
    public static final String INVALID_PARAMS           = "INVALID_PARAMS";

    private final String code;

    public SessionBindingException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() { return code; }
}
