package com.codescout.dispatch.api;

import com.codescout.core.health.HealthCheckService;
import com.codescout.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when all components are UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("session_store", HealthStatus.Status.UP, "Session directory writable",
                        Map.of("directory", "/tmp/sessions")),
                new HealthStatus("reasoning_engine", HealthStatus.Status.UP, "ReasoningEngine available", Map.of())));
        when(healthCheckService.allUp(anyList())).thenReturn(true);
        when(healthCheckService.uptime()).thenReturn(Duration.ofSeconds(42));
        when(healthCheckService.activeSessions()).thenReturn(1);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.session_store.metadata.directory").value("/tmp/sessions"))
                .andExpect(jsonPath("$.components.reasoning_engine.metadata").doesNotExist())
                .andExpect(jsonPath("$.uptime_seconds").value(42))
                .andExpect(jsonPath("$.active_sessions").value(1));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("session_store", HealthStatus.Status.DOWN, "Session directory not writable", Map.of())));
        when(healthCheckService.allUp(anyList())).thenReturn(false);
        when(healthCheckService.uptime()).thenReturn(Duration.ZERO);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.session_store.status").value("DOWN"));
    }
}
