package com.taskpilot.orchestrator.api.dto;

/**
 * Body of POST /sessions/{id}. A missing profile registers a viewer.
 */
public record RegisterSessionRequest(String profile) {

    public RegisterSessionRequest {
        if (profile == null || profile.isBlank()) profile = "viewer";
    }
}
