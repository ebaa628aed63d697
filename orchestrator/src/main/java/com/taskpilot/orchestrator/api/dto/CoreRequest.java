package com.taskpilot.orchestrator.api.dto;

import java.util.Map;

/**
 * Body of POST /rpc.
 *
 * Required: session_id, capability, method
 * Optional: session_profile and session_origin bind a new session (and must
 *   match the binding of an existing one); client_version is checked for the
 *   agent and admin origins; params defaults to empty.
 */
public record CoreRequest(
        String              request_id,
        String              session_id,
        String              session_profile,
        String              session_origin,
        String              client_version,
        String              capability,
        String              method,
        Map<String, Object> params) {

    public CoreRequest {
        if (params == null) params = Map.of();
    }
}
