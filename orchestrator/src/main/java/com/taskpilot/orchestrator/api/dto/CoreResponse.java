package com.taskpilot.orchestrator.api.dto;

/**
 * Envelope returned by POST /rpc. Always sent with HTTP 200; {@code ok} and
 * {@code error} carry the outcome.
 */
public record CoreResponse(String request_id, boolean ok, Object result, CoreError error) {

    public static CoreResponse success(String requestId, Object result) {
        return new CoreResponse(requestId, true, result, null);
    }

    public static CoreResponse failure(String requestId, String code, String message) {
        return new CoreResponse(requestId, false, null, new CoreError(code, message));
    }
}
