package com.maestro.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.core.audit.AuditExport;
import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExecutionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ExecutionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private OrchestrationEngine engine;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static ExecutionView view(String id, ExecutionStatus status) {
        var step = new Step("A", id, "writer", "Write", List.of(), StepStatus.COMPLETED,
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:05Z"),
                "done", null, 0, null);
        return new ExecutionView(id, "report", ExecutionMode.STAGED, status,
                new Progress(100, status, 1, 1, 0, 0, 0, 0), List.of(step), List.of(List.of("A")), Map.of(),
                Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z"),
                Instant.parse("2026-01-01T00:00:05Z"), 5000L);
    }

    // ── POST /api/v1/executions ──────────────────────────────────────

    @Test
    @DisplayName("POST /executions returns 202 Accepted with execution_id")
    void startFromTemplate() throws Exception {
        when(engine.startExecution(eq("report"), isNull(), eq(ExecutionMode.PARALLEL), any()))
                .thenReturn("EXEC-1-0001-00ff");

        String body = objectMapper.writeValueAsString(
                new ExecutionRequest("report", null, "parallel", Map.of("topic", "cheese")));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execution_id").value("EXEC-1-0001-00ff"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("POST /executions accepts ad-hoc steps in snake_case")
    void startAdHoc() throws Exception {
        when(engine.startExecution(isNull(), anyList(), isNull(), isNull())).thenReturn("EXEC-2");

        String body = """
                {"steps": [
                  {"id": "A", "agent": "researcher", "task": "Gather"},
                  {"id": "B", "agent": "writer", "task": "Write", "depends_on": ["A"], "timeout_seconds": 30}
                ]}
                """;

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execution_id").value("EXEC-2"));

        verify(engine).startExecution(isNull(), eq(List.of(
                new StepDefinition("A", "researcher", "Gather", List.of()),
                new StepDefinition("B", "writer", "Write", List.of("A"), 30))), isNull(), isNull());
    }

    @Test
    @DisplayName("POST /executions accepts context entries with null values")
    void startWithNullContextValue() throws Exception {
        when(engine.startExecution(isNull(), anyList(), isNull(), any())).thenReturn("EXEC-3");

        String body = """
                {"steps": [{"id": "A", "agent": "writer", "task": "Write"}],
                 "context": {"note": null, "topic": "billing"}}
                """;

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execution_id").value("EXEC-3"));

        var expected = new HashMap<String, Object>();
        expected.put("note", null);
        expected.put("topic", "billing");
        verify(engine).startExecution(isNull(), anyList(), isNull(), eq(expected));
    }

    @Test
    @DisplayName("POST /executions with an unknown mode returns 400")
    void invalidMode() throws Exception {
        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template_id\": \"report\", \"mode\": \"turbo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("turbo")));
    }

    @Test
    @DisplayName("POST /executions with a cyclic graph returns 400 listing the cycle")
    void cyclicGraph() throws Exception {
        when(engine.startExecution(any(), any(), any(), any()))
                .thenThrow(new CyclicDependencyException(List.of("A", "B")));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template_id\": \"loop\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.cycle", contains("A", "B")));
    }

    @Test
    @DisplayName("POST /executions with an unknown template returns 404")
    void unknownTemplate() throws Exception {
        when(engine.startExecution(any(), any(), any(), any()))
                .thenThrow(new TemplateNotFoundException("nope"));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template_id\": \"nope\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    @DisplayName("POST /executions returns 409 when the execution is already running")
    void alreadyRunning() throws Exception {
        when(engine.startExecution(any(), any(), any(), any()))
                .thenThrow(new AlreadyRunningException("EXEC-1"));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template_id\": \"report\"}"))
                .andExpect(status().isConflict());
    }

    // ── GET /api/v1/executions/{id} ──────────────────────────────────

    @Test
    @DisplayName("GET /executions/{id} returns the execution view")
    void getExecution() throws Exception {
        when(engine.getExecution("EXEC-1")).thenReturn(view("EXEC-1", ExecutionStatus.COMPLETED));

        mockMvc.perform(get("/api/v1/executions/EXEC-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executionId").value("EXEC-1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.progress.percent").value(100))
                .andExpect(jsonPath("$.stages[0]", contains("A")))
                .andExpect(jsonPath("$.steps[0].result").value("done"));
    }

    @Test
    @DisplayName("GET /executions/{id} returns 404 for an unknown execution")
    void getUnknownExecution() throws Exception {
        when(engine.getExecution("missing")).thenThrow(new ExecutionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/executions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("missing")));
    }

    @Test
    @DisplayName("GET /executions lists executions")
    void listExecutions() throws Exception {
        when(engine.listExecutions()).thenReturn(List.of(
                view("EXEC-1", ExecutionStatus.COMPLETED), view("EXEC-2", ExecutionStatus.RUNNING)));

        mockMvc.perform(get("/api/v1/executions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    @DisplayName("GET /executions/{id}/steps/{stepId} returns 404 for an unknown step")
    void unknownStep() throws Exception {
        when(engine.getStep("EXEC-1", "Z")).thenThrow(new StepNotFoundException("EXEC-1", "Z"));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/steps/Z"))
                .andExpect(status().isNotFound());
    }

    // ── POST /api/v1/executions/{id}/cancel ──────────────────────────

    @Test
    @DisplayName("POST /executions/{id}/cancel reports the cancellation and resulting status")
    void cancel() throws Exception {
        when(engine.cancelExecution("EXEC-1")).thenReturn(true);
        when(engine.getExecution("EXEC-1")).thenReturn(view("EXEC-1", ExecutionStatus.CANCELLED));

        mockMvc.perform(post("/api/v1/executions/EXEC-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(true))
                .andExpect(jsonPath("$.status").value("cancelled"));
    }

    @Test
    @DisplayName("POST /executions/{id}/cancel on a finished execution is not an error")
    void cancelFinished() throws Exception {
        when(engine.cancelExecution("EXEC-1")).thenReturn(false);
        when(engine.getExecution("EXEC-1")).thenReturn(view("EXEC-1", ExecutionStatus.COMPLETED));

        mockMvc.perform(post("/api/v1/executions/EXEC-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(false))
                .andExpect(jsonPath("$.status").value("completed"));
    }

    // ── GET /api/v1/executions/{id}/events ───────────────────────────

    @Test
    @DisplayName("GET /executions/{id}/events returns 404 for an unknown execution")
    void eventsUnknownExecution() throws Exception {
        when(engine.getExecution("missing")).thenThrow(new ExecutionNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/executions/missing/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /executions/{id}/events opens a stream from the current view")
    void eventsStream() throws Exception {
        var current = view("EXEC-1", ExecutionStatus.RUNNING);
        when(engine.getExecution("EXEC-1")).thenReturn(current);
        when(sseStreamingService.createEmitter(current)).thenReturn(new SseEmitter(1_000L));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());

        verify(sseStreamingService).createEmitter(current);
    }

    // ── Audit and communications ─────────────────────────────────────

    @Test
    @DisplayName("GET /executions/{id}/audit returns the records in order")
    void audit() throws Exception {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        when(engine.listAudit("EXEC-1")).thenReturn(List.of(
                new AuditRecord("AUD-1", 1, "EXEC-1", null, null, "execution_started", "running", "Started", now),
                new AuditRecord("AUD-2", 2, "EXEC-1", "A", "writer", "step_started", "running", "Started A", now)));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].stepId").value("A"));
    }

    @Test
    @DisplayName("GET /executions/{id}/audit/export streams CSV as an attachment")
    void exportCsv() throws Exception {
        byte[] csv = "id,sequence\nAUD-1,1\n".getBytes(StandardCharsets.UTF_8);
        when(engine.exportAudit("EXEC-1", "csv"))
                .thenReturn(new AuditExport("EXEC-1", ExportFormat.CSV, csv, 1));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/audit/export"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("audit-EXEC-1.csv")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().bytes(csv));
    }

    @Test
    @DisplayName("GET /executions/{id}/audit/export?format=pdf returns 501")
    void exportPdf() throws Exception {
        when(engine.exportAudit("EXEC-1", "pdf")).thenThrow(
                new UnsupportedExportFormatException("PDF export is not implemented", true, List.of("csv")));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/audit/export").param("format", "pdf"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.supported_formats", contains("csv")));
    }

    @Test
    @DisplayName("GET /executions/{id}/audit/export with an unknown format returns 400")
    void exportUnknownFormat() throws Exception {
        when(engine.exportAudit("EXEC-1", "xlsx")).thenThrow(
                new UnsupportedExportFormatException("Unknown export format: xlsx", false, List.of("csv")));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/audit/export").param("format", "xlsx"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /executions/{id}/communications lists mention records")
    void communications() throws Exception {
        when(engine.listCommunications("EXEC-1")).thenReturn(List.of(
                new CommunicationRecord("COMM-EXEC-1.A.reviewer", "EXEC-1", "A", "writer", "reviewer",
                        "@reviewer please check", null, Instant.parse("2026-01-01T00:00:00Z"), null)));

        mockMvc.perform(get("/api/v1/executions/EXEC-1/communications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toAgent").value("reviewer"));
    }
}
