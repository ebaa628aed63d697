package com.taskpilot.orchestrator.api;

import com.taskpilot.orchestrator.api.dto.CoreRequest;
import com.taskpilot.orchestrator.api.dto.CoreResponse;
import com.taskpilot.orchestrator.model.AuditEvent;
import com.taskpilot.orchestrator.repository.AuditEventRepository;
import com.taskpilot.orchestrator.security.AuthorizationException;
import com.taskpilot.orchestrator.security.ProtocolCall;
import com.taskpilot.orchestrator.security.SessionBinding;
import com.taskpilot.orchestrator.security.SessionBindingException;
import com.taskpilot.orchestrator.security.SessionRegistry;
import com.taskpilot.orchestrator.security.TaskScopeEnforcer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for protocol requests.
 *
 * Order:
 * <ol>
 *   <li>resolve (or create) the session binding</li>
 *   <li>enforce the bound profile's policy</li>
 *   <li>enforce task scope for {@code task:<id>} sessions</li>
 *   <li>check the client version for origins that require it</li>
 *   <li>run the handler</li>
 * </ol>
 * Any failure in 1-4 ends the request; the handler never runs for it.
 * Every request, denied or not, is audited and counted.
 */
@Service
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    static final String MCP_OUTDATED    = "MCP_OUTDATED";
    static final String INVALID_PARAMS  = "INVALID_PARAMS";
    static final String UNKNOWN_METHOD  = "UNKNOWN_METHOD";
    static final String INTERNAL_ERROR  = "INTERNAL_ERROR";

    private final SessionRegistry      sessions;
    private final TaskScopeEnforcer    taskScope;
    private final RequestHandlers      handlers;
    private final AuditEventRepository auditRepo;
    private final MeterRegistry        meterRegistry;
    private final String               coreVersion;

    public RequestDispatcher(SessionRegistry sessions,
                             TaskScopeEnforcer taskScope,
                             RequestHandlers handlers,
                             AuditEventRepository auditRepo,
                             MeterRegistry meterRegistry,
                             @Value("${taskpilot.core.version}") String coreVersion) {
        this.sessions      = sessions;
        this.taskScope     = taskScope;
        this.handlers      = handlers;
        this.auditRepo     = auditRepo;
        this.meterRegistry = meterRegistry;
        this.coreVersion   = coreVersion;
    }

    public CoreResponse handleRequest(CoreRequest request) {
        SessionBinding binding = null;
        CoreResponse response;
        try {
            requireEnvelope(request);
            binding = sessions.resolve(request.session_id(), request.session_profile(), request.session_origin());
            binding.policy().enforce(request.capability(), request.method());
            taskScope.enforce(binding, request.capability(), request.method(), request.params());
            response = checkClientVersion(request, binding)
                    .orElseGet(() -> dispatch(request));
        } catch (SessionBindingException e) {
            response = deny(request, e.getCode(), e.getMessage());
        } catch (AuthorizationException e) {
            response = deny(request, e.getCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            response = CoreResponse.failure(request.request_id(), INVALID_PARAMS, e.getMessage());
        }

        record(request, binding, response);
        return response;
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private static void requireEnvelope(CoreRequest request) {
        if (isBlank(request.session_id()))  throw new IllegalArgumentException("Missing required field: session_id");
        if (isBlank(request.capability()))  throw new IllegalArgumentException("Missing required field: capability");
        if (isBlank(request.method()))      throw new IllegalArgumentException("Missing required field: method");
    }

    private Optional<CoreResponse> checkClientVersion(CoreRequest request, SessionBinding binding) {
        if (!binding.origin().versionChecked()) return Optional.empty();

        String clientVersion = request.client_version() == null ? "" : request.client_version().strip();
        if (clientVersion.isEmpty()) {
            return Optional.of(CoreResponse.failure(request.request_id(), MCP_OUTDATED,
                    "Client did not report its version. Restart the client session to load the current release."));
        }
        if (!clientVersion.equals(coreVersion)) {
            return Optional.of(CoreResponse.failure(request.request_id(), MCP_OUTDATED,
                    "Client version '" + clientVersion + "' does not match core version '" + coreVersion
                    + "'. Restart the client session."));
        }
        return Optional.empty();
    }

    private CoreResponse dispatch(CoreRequest request) {
        String name = request.capability() + "." + request.method();
        Optional<RequestHandler> handler = ProtocolCall.find(request.capability(), request.method())
                .flatMap(handlers::find);
        if (handler.isEmpty()) {
            return CoreResponse.failure(request.request_id(), UNKNOWN_METHOD, "No handler for " + name);
        }

        try {
            Object result = handler.get().handle(new RequestParams(request.params()));
            return CoreResponse.success(request.request_id(), result);
        } catch (IllegalArgumentException e) {
            return CoreResponse.failure(request.request_id(), INVALID_PARAMS, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error for {}: {}", name, e.getMessage(), e);
            return CoreResponse.failure(request.request_id(), INTERNAL_ERROR, "Internal error processing " + name);
        }
    }

    private static CoreResponse deny(CoreRequest request, String code, String message) {
        log.warn("Denied {}.{} for session '{}': {} {}",
                request.capability(), request.method(), request.session_id(), code, message);
        return CoreResponse.failure(request.request_id(), code, message);
    }

    // ------------------------------------------------------------------
    // Audit and metrics
    // ------------------------------------------------------------------

    private void record(CoreRequest request, SessionBinding binding, CoreResponse response) {
        String status = response.ok() ? "ok" : response.error().code();
        boolean registered = ProtocolCall.find(request.capability(), request.method()).isPresent();
        meterRegistry.counter("taskpilot.requests",
                "capability", registered ? request.capability() : "unregistered",
                "method",     registered ? request.method()     : "unregistered",
                "status",     status).increment();

        try {
            String profile = binding != null
                    ? binding.profile().wireName()
                    : Optional.ofNullable(request.session_profile()).orElse("unbound");
            auditRepo.save(new AuditEvent(
                    Optional.ofNullable(request.session_id()).orElse(""),
                    profile,
                    Optional.ofNullable(request.capability()).orElse(""),
                    Optional.ofNullable(request.method()).orElse(""),
                    operationSucceeded(response),
                    response.ok() ? null : response.error().code()));
        } catch (RuntimeException e) {
            log.warn("Failed to record audit event for {}.{}: {}",
                    request.capability(), request.method(), e.getMessage());
        }
    }

    /** A successful envelope whose result reports {@code success: false} is audited as a failure. */
    static boolean operationSucceeded(CoreResponse response) {
        if (!response.ok()) return false;
        if (response.result() instanceof Map<?, ?> result && result.get("success") instanceof Boolean success) {
            return success;
        }
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
