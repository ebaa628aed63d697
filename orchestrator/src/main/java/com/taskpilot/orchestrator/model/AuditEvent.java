package com.taskpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one handled request, denied requests included.
 *
 * DB table: audit_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Column(nullable = false)
    private String profile;

    @Column(nullable = false)
    private String capability;

    @Column(nullable = false)
    private String method;

    @Column(nullable = false)
    private boolean ok;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt = Instant.now();

    protected AuditEvent() {}   // required by JPA

    public AuditEvent(String sessionId, String profile, String capability,
                      String method, boolean ok, String errorCode) {
        this.sessionId  = sessionId;
        this.profile    = profile;
        this.capability = capability;
        this.method     = method;
        this.ok         = ok;
        this.errorCode  = errorCode;
    }

    public UUID    getId()         { return id; }
    public String  getSessionId()  { return sessionId; }
    public String  getProfile()    { return profile; }
    public String  getCapability() { return capability; }
    public String  getMethod()     { return method; }
    public boolean isOk()          { return ok; }
    public String  getErrorCode()  { return errorCode; }
    public Instant getOccurredAt() { return occurredAt; }
}
