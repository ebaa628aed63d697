package com.taskpilot.orchestrator.api;

import com.taskpilot.orchestrator.api.dto.CoreResponse;
import com.taskpilot.orchestrator.security.AuthorizationPolicy;
import com.taskpilot.orchestrator.security.CapabilityProfile;
import com.taskpilot.orchestrator.security.SessionBinding;
import com.taskpilot.orchestrator.security.SessionBindingException;
import com.taskpilot.orchestrator.security.SessionNamespace;
import com.taskpilot.orchestrator.security.SessionOrigin;
import com.taskpilot.orchestrator.security.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RequestController.
 *
 * @WebMvcTest starts only the web layer; the dispatcher and the session
 * registry are mocks.
 */
@WebMvcTest(RequestController.class)
class RequestControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean RequestDispatcher dispatcher;
    @MockitoBean SessionRegistry   sessions;

    // ------------------------------------------------------------------
    // POST /rpc
    // ------------------------------------------------------------------

    @Test
    void rpc_success_returns200WithEnvelope() throws Exception {
        when(dispatcher.handleRequest(any())).thenReturn(CoreResponse.success("req-7", List.of("a", "b")));

        mockMvc.perform(post("/rpc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request_id":"req-7","session_id":"cli","capability":"tasks","method":"list"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value("req-7"))
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.result[1]").value("b"));
    }

    @Test
    void rpc_denied_stillReturns200WithErrorCode() throws Exception {
        when(dispatcher.handleRequest(any())).thenReturn(CoreResponse.failure("req-8", "AUTHORIZATION_DENIED",
                "Profile 'viewer' is not authorized for tasks.delete"));

        mockMvc.perform(post("/rpc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request_id":"req-8","session_id":"cli","capability":"tasks","method":"delete",
                                 "params":{"task_id":"x"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error.code").value("AUTHORIZATION_DENIED"));
    }

    // ------------------------------------------------------------------
    // /sessions/{id}
    // ------------------------------------------------------------------

    @Test
    void registerSession_validProfile_returns201() throws Exception {
        when(sessions.register("cli", "operator")).thenReturn(binding("cli", CapabilityProfile.OPERATOR));

        mockMvc.perform(post("/sessions/{id}", "cli")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profile":"operator"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session_id").value("cli"))
                .andExpect(jsonPath("$.profile").value("operator"))
                .andExpect(jsonPath("$.origin").value("legacy"))
                .andExpect(jsonPath("$.namespace").value("default"));
    }

    @Test
    void registerSession_noBody_registersViewer() throws Exception {
        when(sessions.register("cli", "viewer")).thenReturn(binding("cli", CapabilityProfile.VIEWER));

        mockMvc.perform(post("/sessions/{id}", "cli"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.profile").value("viewer"));
    }

    @Test
    void registerSession_unknownProfile_returns400() throws Exception {
        when(sessions.register("cli", "root")).thenThrow(new SessionBindingException(
                SessionBindingException.INVALID_PROFILE, "Unknown capability profile 'root'"));

        mockMvc.perform(post("/sessions/{id}", "cli")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profile":"root"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void registerSession_alreadyBoundDifferently_returns409() throws Exception {
        when(sessions.register("cli", "maintainer")).thenThrow(new SessionBindingException(
                SessionBindingException.INVALID_PROFILE, "Session 'cli' is already bound to profile 'viewer'"));
        when(sessions.find("cli")).thenReturn(Optional.of(binding("cli", CapabilityProfile.VIEWER)));

        mockMvc.perform(post("/sessions/{id}", "cli")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"profile":"maintainer"}
                                """))
                .andExpect(status().isConflict());
    }

    @Test
    void unregisterSession_returns204() throws Exception {
        mockMvc.perform(delete("/sessions/{id}", "cli"))
                .andExpect(status().isNoContent());

        verify(sessions).unregister("cli");
    }

    private static SessionBinding binding(String sessionId, CapabilityProfile profile) {
        return new SessionBinding(sessionId, new AuthorizationPolicy(profile),
                SessionOrigin.LEGACY, SessionNamespace.DEFAULT, sessionId);
    }
}
