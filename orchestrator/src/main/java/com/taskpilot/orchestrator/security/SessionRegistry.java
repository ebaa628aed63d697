package com.taskpilot.orchestrator.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session id → {@link SessionBinding}, fixed on first use.
 *
 * An unseen session binds the requested profile (VIEWER when none), capped at
 * the origin's ceiling. Later requests may repeat the bound profile and
 * origin but never change them.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionBinding> bindings = new HashMap<>();

    /**
     * Bind a session explicitly, as the legacy origin. Registering a bound
     * session again returns its binding if nothing changes.
     *
     * @throws SessionBindingException INVALID_PROFILE for an unknown or different profile,
     *         SESSION_ORIGIN_MISMATCH when the session was bound under another origin
     */
    public synchronized SessionBinding register(String sessionId, String profile) {
        CapabilityProfile parsed = parseProfile(profile);
        SessionBinding existing = bindings.get(sessionId);
        if (existing != null) {
            checkUnchanged(existing, parsed.wireName(), SessionOrigin.LEGACY.wireName());
            return existing;
        }
        SessionNamespace.Scope scope = SessionNamespace.parse(sessionId);
        SessionBinding binding = new SessionBinding(sessionId, new AuthorizationPolicy(parsed),
                SessionOrigin.LEGACY, scope.namespace(), scope.scopeId());
        bindings.put(sessionId, binding);
        log.info("Registered session '{}' as {}", sessionId, parsed.wireName());
        return binding;
    }

    public synchronized void unregister(String sessionId) {
        if (bindings.remove(sessionId) != null) {
            log.info("Unregistered session '{}'", sessionId);
        }
    }

    public synchronized Optional<SessionBinding> find(String sessionId) {
        return Optional.ofNullable(bindings.get(sessionId));
    }

    /**
     * Binding for a request, creating it on first sight.
     *
     * @param requestedProfile profile named by the request, may be null
     * @param requestedOrigin  origin named by the request, may be null
     * @throws SessionBindingException INVALID_PROFILE, INVALID_ORIGIN,
     *         SESSION_ORIGIN_MISMATCH or SESSION_NAMESPACE_DENIED
     */
    public synchronized SessionBinding resolve(String sessionId, String requestedProfile, String requestedOrigin) {
        SessionBinding existing = bindings.get(sessionId);
        if (existing != null) {
            checkUnchanged(existing, requestedProfile, requestedOrigin);
            return existing;
        }

        SessionOrigin origin = SessionOrigin.parse(requestedOrigin);
        CapabilityProfile requested = isBlank(requestedProfile)
                ? CapabilityProfile.DEFAULT
                : parseProfile(requestedProfile);
        CapabilityProfile effective = requested.cappedAt(origin.ceiling());

        SessionNamespace.Scope scope = SessionNamespace.parse(sessionId);
        if (!origin.allows(scope.namespace())) {
            throw new SessionBindingException(SessionBindingException.SESSION_NAMESPACE_DENIED,
                    "Origin '" + origin.wireName() + "' is not authorized for session namespace '"
                    + scope.namespace().wireName() + "'. Allowed namespaces: " + origin.allowedNamespaces());
        }

        SessionBinding binding = new SessionBinding(sessionId, new AuthorizationPolicy(effective),
                origin, scope.namespace(), scope.scopeId());
        bindings.put(sessionId, binding);
        if (effective != requested) {
            log.info("Session '{}' bound as {} (requested {}, capped by origin {})",
                    sessionId, effective.wireName(), requested.wireName(), origin.wireName());
        } else {
            log.debug("Session '{}' bound as {} (origin {})", sessionId, effective.wireName(), origin.wireName());
        }
        return binding;
    }

    private static void checkUnchanged(SessionBinding existing, String requestedProfile, String requestedOrigin) {
        if (!isBlank(requestedProfile)) {
            CapabilityProfile requested = parseProfile(requestedProfile);
            if (requested != existing.profile()) {
                throw new SessionBindingException(SessionBindingException.INVALID_PROFILE,
                        "Session '" + existing.sessionId() + "' is already bound to profile '"
                        + existing.profile().wireName() + "', cannot switch to '" + requestedProfile + "'");
            }
        }
        if (!isBlank(requestedOrigin)) {
            SessionOrigin requested = SessionOrigin.parse(requestedOrigin);
            if (requested != existing.origin()) {
                throw new SessionBindingException(SessionBindingException.SESSION_ORIGIN_MISMATCH,
                        "Session '" + existing.sessionId() + "' is already bound to origin '"
                        + existing.origin().wireName() + "', cannot switch to '" + requested.wireName() + "'");
            }
        }
    }

    private static CapabilityProfile parseProfile(String profile) {
        try {
            return CapabilityProfile.parse(profile);
        } catch (IllegalArgumentException e) {
            throw new SessionBindingException(SessionBindingException.INVALID_PROFILE, e.getMessage());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
