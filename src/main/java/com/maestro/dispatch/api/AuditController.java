package com.maestro.dispatch.api;

import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.MaestroException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * REST controller for cross-execution audit queries and communication responses.
 */
@RestController
public class AuditController {

    private static final int MAX_LIMIT = 1000;

    private final OrchestrationEngine engine;

    public AuditController(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/api/v1/audit/agents/{agentId}")
    public ResponseEntity<Object> agentAudit(@PathVariable String agentId,
                                             @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        return ResponseEntity.ok(engine.listAgentAudit(agentId, limit));
    }

    @GetMapping("/api/v1/audit/statistics")
    public ResponseEntity<Object> statistics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            return ResponseEntity.badRequest().body(Map.of("error", "from must be before to"));
        }
        return ResponseEntity.ok(engine.auditStatistics(from, to));
    }

    /**
     * POST /api/v1/communications/{id}/response: Attach a response. Repeating the call is harmless.
     */
    @PostMapping("/api/v1/communications/{id}/response")
    public ResponseEntity<Object> respond(@PathVariable String id, @RequestBody ResponseRequest request) {
        try {
            boolean attached = engine.respondToCommunication(id, request.response());
            return ResponseEntity.ok(Map.of("communication_id", id, "attached", attached));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
