package com.taskpilot.orchestrator.api.dto;

import com.taskpilot.orchestrator.security.SessionBinding;

public record SessionResponse(String session_id, String profile, String origin, String namespace) {

    public static SessionResponse from(SessionBinding b) {
        return new SessionResponse(
                b.sessionId(),
                b.profile().wireName(),
                b.origin().wireName(),
                b.namespace().wireName());
    }
}
