package com.codescout.dispatch.api;

import com.codescout.core.llm.ConversationMessage;
import com.codescout.core.navigation.TraceEntry;
import com.codescout.core.session.IncompatibleSessionException;
import com.codescout.core.session.Session;
import com.codescout.core.session.SessionBusyException;
import com.codescout.core.session.SessionSort;
import com.codescout.core.session.SessionStore;
import com.codescout.core.session.SessionSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-04-01T09:00:00Z");
    private static final String ROOT = SessionController.canonical("/nonexistent/codescout/app");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionStore sessionStore;

    private static Session session() {
        return new Session("id-1", "feature", ROOT, NOW, NOW,
                List.of(ConversationMessage.user("seed"), ConversationMessage.assistant("ISSUE: x", List.of())),
                List.of(new TraceEntry("read_file", Map.of("filepath", "a.py"), 10, "ok")),
                3, 4200L, 1);
    }

    @Test
    @DisplayName("GET /sessions lists summaries with the default sort")
    void listSessions() throws Exception {
        when(sessionStore.list(isNull(), eq(50), eq(SessionSort.LAST_UPDATED)))
                .thenReturn(List.of(SessionSummary.of(session())));

        mockMvc.perform(get("/api/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("feature"))
                .andExpect(jsonPath("$[0].iteration_count").value(3))
                .andExpect(jsonPath("$[0].last_issue_count").value(1));
    }

    @Test
    @DisplayName("GET /sessions filters by canonical project root")
    void listSessionsFiltered() throws Exception {
        when(sessionStore.list(anyString(), anyInt(), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/sessions")
                        .param("project_root", "/nonexistent/codescout/app")
                        .param("limit", "5")
                        .param("sort", "name"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        verify(sessionStore).list(ROOT, 5, SessionSort.NAME);
    }

    @Test
    @DisplayName("GET /sessions with an unknown sort key returns 400")
    void listSessionsBadSort() throws Exception {
        mockMvc.perform(get("/api/v1/sessions").param("sort", "size"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_argument"));
    }

    @Test
    @DisplayName("GET /sessions/{name} returns session detail")
    void getSession() throws Exception {
        when(sessionStore.load("feature", ROOT)).thenReturn(Optional.of(session()));

        mockMvc.perform(get("/api/v1/sessions/feature").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.name").value("feature"))
                .andExpect(jsonPath("$.message_count").value(2))
                .andExpect(jsonPath("$.trace_size").value(1))
                .andExpect(jsonPath("$.cumulative_token_estimate").value(4200));
    }

    @Test
    @DisplayName("GET /sessions/{name} for unknown session returns 404")
    void getSessionNotFound() throws Exception {
        when(sessionStore.load(anyString(), anyString())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/sessions/missing").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /sessions/{name} with an unsupported record format returns 409")
    void getSessionIncompatible() throws Exception {
        when(sessionStore.load(anyString(), anyString()))
                .thenThrow(new IncompatibleSessionException("Session record format 2 is newer than supported version 1"));

        mockMvc.perform(get("/api/v1/sessions/feature").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("incompatible_session"));
    }

    @Test
    @DisplayName("DELETE /sessions/{name} returns 200, then 404")
    void deleteSession() throws Exception {
        when(sessionStore.delete("feature", ROOT)).thenReturn(true, false);

        mockMvc.perform(delete("/api/v1/sessions/feature").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Session 'feature' deleted"));
        mockMvc.perform(delete("/api/v1/sessions/feature").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /sessions/{name} returns 409 while a review holds the session")
    void deleteBusySession() throws Exception {
        when(sessionStore.delete("feature", ROOT))
                .thenThrow(new SessionBusyException("Session 'feature' is in use by another review"));

        mockMvc.perform(delete("/api/v1/sessions/feature").param("project_root", "/nonexistent/codescout/app"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("session_busy"));
    }
}
