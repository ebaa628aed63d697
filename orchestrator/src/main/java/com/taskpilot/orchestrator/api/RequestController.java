package com.taskpilot.orchestrator.api;

import com.taskpilot.orchestrator.api.dto.CoreRequest;
import com.taskpilot.orchestrator.api.dto.CoreResponse;
import com.taskpilot.orchestrator.api.dto.RegisterSessionRequest;
import com.taskpilot.orchestrator.api.dto.SessionResponse;
import com.taskpilot.orchestrator.security.SessionBindingException;
import com.taskpilot.orchestrator.security.SessionRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * HTTP entry points.
 *
 * POST   /rpc             one protocol request; the envelope carries the outcome, always HTTP 200
 * POST   /sessions/{id}   bind a session to a profile ahead of its first request
 * DELETE /sessions/{id}   drop a session binding
 */
@RestController
public class RequestController {

    private final RequestDispatcher dispatcher;
    private final SessionRegistry   sessions;

    public RequestController(RequestDispatcher dispatcher, SessionRegistry sessions) {
        this.dispatcher = dispatcher;
        this.sessions   = sessions;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/rpc \
     *     -H "Content-Type: application/json" \
     *     -d '{"request_id":"1","session_id":"cli","capability":"tasks","method":"list"}'
     */
    @PostMapping("/rpc")
    public CoreResponse handle(@RequestBody CoreRequest request) {
        return dispatcher.handleRequest(request);
    }

    /** Returns 400 for an unknown profile name, 409 when the session is already bound differently. */
    @PostMapping("/sessions/{id}")
    public ResponseEntity<SessionResponse> register(@PathVariable String id,
                                                    @RequestBody(required = false) RegisterSessionRequest req) {
        String profile = req == null ? "viewer" : req.profile();
        try {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(SessionResponse.from(sessions.register(id, profile)));
        } catch (SessionBindingException e) {
            HttpStatus status = sessions.find(id).isPresent() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
            throw new ResponseStatusException(status, e.getMessage());
        }
    }

    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Void> unregister(@PathVariable String id) {
        sessions.unregister(id);
        return ResponseEntity.noContent().build();
    }
}
