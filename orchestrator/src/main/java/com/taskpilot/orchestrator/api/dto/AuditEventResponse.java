package com.taskpilot.orchestrator.api.dto;

import com.taskpilot.orchestrator.model.AuditEvent;

import java.time.Instant;

public record AuditEventResponse(
        String  session_id,
        String  profile,
        String  capability,
        String  method,
        boolean ok,
        String  error_code,
        Instant occurred_at
) {
    public static AuditEventResponse from(AuditEvent e) {
        return new AuditEventResponse(
                e.getSessionId(),
                e.getProfile(),
                e.getCapability(),
                e.getMethod(),
                e.isOk(),
                e.getErrorCode(),
                e.getOccurredAt()
        );
    }
}
