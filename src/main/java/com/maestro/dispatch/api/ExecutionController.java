package com.maestro.dispatch.api;

import com.maestro.core.audit.AuditExport;
import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.ExecutionMode;
import com.maestro.core.model.ExecutionNotFoundException;
import com.maestro.core.model.ExecutionView;
import com.maestro.core.model.MaestroException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for execution lifecycle, audit and communication queries.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final OrchestrationEngine engine;
    private final SseStreamingService sseStreamingService;

    public ExecutionController(OrchestrationEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/executions: Submit a new execution. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Object> startExecution(@RequestBody ExecutionRequest request) {
        ExecutionMode mode = null;
        if (request.mode() != null && !request.mode().isBlank()) {
            try {
                mode = ExecutionMode.parse(request.mode());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid mode: " + request.mode()));
            }
        }
        try {
            String executionId = engine.startExecution(request.templateId(), request.steps(), mode, request.context());
            log.info("Accepted execution {}", executionId);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("execution_id", executionId, "status", "running"));
        } catch (MaestroException e) {
            log.info("Rejected execution request: {}", e.getMessage());
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping
    public ResponseEntity<Object> listExecutions() {
        return ResponseEntity.ok(engine.listExecutions());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> getExecution(@PathVariable String id) {
        try {
            return ResponseEntity.ok(engine.getExecution(id));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/steps/{stepId}")
    public ResponseEntity<Object> getStep(@PathVariable String id, @PathVariable String stepId) {
        try {
            return ResponseEntity.ok(engine.getStep(id, stepId));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/report")
    public ResponseEntity<Object> getReport(@PathVariable String id) {
        try {
            return ResponseEntity.ok(engine.report(id));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/v1/executions/{id}/cancel: Cancel a running execution. Cancelling a finished
     * execution is not an error; {@code cancelled} is false in that case.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Object> cancelExecution(@PathVariable String id) {
        try {
            boolean cancelled = engine.cancelExecution(id);
            var view = engine.getExecution(id);
            return ResponseEntity.ok(Map.of(
                    "execution_id", id,
                    "cancelled", cancelled,
                    "status", view.status().name().toLowerCase()));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<Object> getAudit(@PathVariable String id) {
        try {
            return ResponseEntity.ok(engine.listAudit(id));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/audit/export")
    public ResponseEntity<Object> exportAudit(@PathVariable String id,
                                              @RequestParam(defaultValue = "csv") String format) {
        try {
            AuditExport export = engine.exportAudit(id, format);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(export.contentType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + export.fileName() + "\"")
                    .body(export.content());
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/communications")
    public ResponseEntity<Object> getCommunications(@PathVariable String id) {
        try {
            return ResponseEntity.ok(engine.listCommunications(id));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * GET /api/v1/executions/{id}/events: SSE stream of execution events, opened with a snapshot
     * of the current state. 404 when the execution is unknown.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        ExecutionView current;
        try {
            current = engine.getExecution(id);
        } catch (ExecutionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(current));
    }
}
