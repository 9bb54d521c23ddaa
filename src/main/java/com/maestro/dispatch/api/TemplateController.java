package com.maestro.dispatch.api;

import com.maestro.core.engine.OrchestrationEngine;
import com.maestro.core.model.MaestroException;
import com.maestro.core.model.TemplateSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the workflow template catalogue.
 */
@RestController
@RequestMapping("/api/v1/templates")
public class TemplateController {

    private final OrchestrationEngine engine;

    public TemplateController(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<List<TemplateSummary>> listTemplates() {
        return ResponseEntity.ok(engine.listTemplates());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> getTemplate(@PathVariable String id) {
        try {
            return ResponseEntity.ok(engine.getTemplate(id));
        } catch (MaestroException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
