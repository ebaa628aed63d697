package com.taskpilot.orchestrator.security;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static com.taskpilot.orchestrator.security.SessionNamespace.DEFAULT;
import static com.taskpilot.orchestrator.security.SessionNamespace.EXT;
import static com.taskpilot.orchestrator.security.SessionNamespace.PLANNER;
import static com.taskpilot.orchestrator.security.SessionNamespace.TASK;

/**
 * Caller class declared by a request. Caps the profile a session can bind and
 * the session namespaces it may use.
 */
public enum SessionOrigin {

    /** No origin declared. */
    LEGACY     ("legacy",      CapabilityProfile.MAINTAINER,  EnumSet.of(DEFAULT, TASK, PLANNER, EXT), false),
    /** Tool channel of a running agent. */
    KAGAN      ("kagan",       CapabilityProfile.PAIR_WORKER, EnumSet.of(DEFAULT, TASK, PLANNER),      true),
    /** External admin client. */
    KAGAN_ADMIN("kagan_admin", CapabilityProfile.MAINTAINER,  EnumSet.of(EXT),                         true),
    /** Terminal UI. */
    TUI        ("tui",         CapabilityProfile.MAINTAINER,  EnumSet.of(SessionNamespace.TUI),        false);

    private final String wireName;
    private final CapabilityProfile ceiling;
    private final Set<SessionNamespace> namespaces;
    private final boolean versionChecked;

    SessionOrigin(String wireName, CapabilityProfile ceiling, Set<SessionNamespace> namespaces,
                  boolean versionChecked) {
        this.wireName       = wireName;
        this.ceiling        = ceiling;
        this.namespaces     = namespaces;
        this.versionChecked = versionChecked;
    }

    public String            wireName()       { return wireName; }
    public CapabilityProfile ceiling()        { return ceiling; }
    public boolean           versionChecked() { return versionChecked; }

    public boolean allows(SessionNamespace namespace) {
        return namespaces.contains(namespace);
    }

    String allowedNamespaces() {
        return namespaces.stream().map(SessionNamespace::wireName).sorted().collect(Collectors.joining(", "));
    }

    /**
     * Null or blank means LEGACY.
     *
     * @throws SessionBindingException INVALID_ORIGIN for an unknown value
     */
    public static SessionOrigin parse(String value) {
        if (value == null || value.isBlank()) return LEGACY;
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (SessionOrigin o : values()) {
            if (o.wireName.equals(normalized)) return o;
        }
        String valid = Arrays.stream(values()).map(SessionOrigin::wireName).sorted().collect(Collectors.joining(", "));
        throw new SessionBindingException(SessionBindingException.INVALID_ORIGIN,
                "Unknown session origin '" + value + "'. Valid origins: " + valid);
    }
}
