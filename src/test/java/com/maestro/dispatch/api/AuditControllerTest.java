package com.maestro.dispatch.api;

import com.maestro.core.audit.AuditStatistics;
import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.CommunicationNotFoundException;
import com.maestro.core.model.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AuditControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestrationEngine engine;

    @Test
    @DisplayName("GET /audit/agents/{agentId} passes the limit through")
    void agentAudit() throws Exception {
        when(engine.listAgentAudit("writer", 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/audit/agents/writer").param("limit", "5"))
                .andExpect(status().isOk());

        verify(engine).listAgentAudit("writer", 5);
    }

    @Test
    @DisplayName("GET /audit/agents/{agentId} rejects an out-of-range limit")
    void agentAuditBadLimit() throws Exception {
        mockMvc.perform(get("/api/v1/audit/agents/writer").param("limit", "0"))
                .andExpect(status().isBadRequest());

        verify(engine, never()).listAgentAudit(anyString(), anyInt());
    }

    @Test
    @DisplayName("GET /audit/statistics returns aggregates for the window")
    void statistics() throws Exception {
        Instant from = Instant.parse("2026-01-01T00:00:00Z");
        Instant to = Instant.parse("2026-01-02T00:00:00Z");
        when(engine.auditStatistics(from, to)).thenReturn(new AuditStatistics(from, to, 10, 2,
                Map.of("step_completed", 3L), Map.of("completed", 3L), Map.of("writer", 4L), 75.0));

        mockMvc.perform(get("/api/v1/audit/statistics")
                        .param("from", "2026-01-01T00:00:00Z")
                        .param("to", "2026-01-02T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecords").value(10))
                .andExpect(jsonPath("$.successRate").value(75.0));
    }

    @Test
    @DisplayName("GET /audit/statistics rejects an inverted window")
    void statisticsInvertedWindow() throws Exception {
        mockMvc.perform(get("/api/v1/audit/statistics")
                        .param("from", "2026-01-02T00:00:00Z")
                        .param("to", "2026-01-01T00:00:00Z"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /communications/{id}/response attaches the response")
    void respond() throws Exception {
        when(engine.respondToCommunication("COMM-1", "Looks good")).thenReturn(true);

        mockMvc.perform(post("/api/v1/communications/COMM-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\": \"Looks good\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.communication_id").value("COMM-1"))
                .andExpect(jsonPath("$.attached").value(true));
    }

    @Test
    @DisplayName("POST /communications/{id}/response keeps dotted ids whole")
    void respondDottedId() throws Exception {
        when(engine.respondToCommunication("COMM-EXEC-2026-0007-3fa2.A.reviewer", "ok")).thenReturn(true);

        mockMvc.perform(post("/api/v1/communications/COMM-EXEC-2026-0007-3fa2.A.reviewer/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\": \"ok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.communication_id").value("COMM-EXEC-2026-0007-3fa2.A.reviewer"));
    }

    @Test
    @DisplayName("POST /communications/{id}/response returns 404 for an unknown record")
    void respondUnknown() throws Exception {
        when(engine.respondToCommunication("COMM-X", "hi"))
                .thenThrow(new CommunicationNotFoundException("COMM-X"));

        mockMvc.perform(post("/api/v1/communications/COMM-X/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\": \"hi\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /communications/{id}/response rejects a blank response")
    void respondBlank() throws Exception {
        when(engine.respondToCommunication("COMM-1", " "))
                .thenThrow(new ValidationException("Response text is required"));

        mockMvc.perform(post("/api/v1/communications/COMM-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\": \" \"}"))
                .andExpect(status().isBadRequest());
    }
}
