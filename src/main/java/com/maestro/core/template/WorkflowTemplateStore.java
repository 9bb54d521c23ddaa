package com.maestro.core.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.agent.AgentCatalog;
import com.maestro.core.model.StepDefinition;
import com.maestro.core.model.TemplateNotFoundException;
import com.maestro.core.model.TemplateSummary;
import com.maestro.core.model.ValidationException;
import com.maestro.core.model.WorkflowTemplate;
import com.maestro.core.scheduler.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of reusable workflow templates.
 * <p>
 * Templates are loaded at startup from a JSON catalogue of the form
 * {@code {"templates": [{"id", "name", "description", "steps": [...]}]}}. A template is only
 * registered if its step graph is valid; invalid entries are logged and left out.
 */
@Service
public class WorkflowTemplateStore {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTemplateStore.class);

    record Catalogue(List<WorkflowTemplate> templates) {}

    private final DependencyResolver resolver;
    private final AgentCatalog agentCatalog;
    /** Insertion-ordered so listings follow the catalogue. */
    private final Map<String, WorkflowTemplate> templates = Collections.synchronizedMap(new LinkedHashMap<>());

    @Autowired
    public WorkflowTemplateStore(TemplateProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                 DependencyResolver resolver, AgentCatalog agentCatalog) {
        this(resolver, agentCatalog);
        loadCatalogue(properties.getLocation(), resourceLoader, objectMapper);
    }

    WorkflowTemplateStore(DependencyResolver resolver, AgentCatalog agentCatalog) {
        this.resolver = resolver;
        this.agentCatalog = agentCatalog;
    }

    /**
     * Validates and registers a template. Templates are immutable, so an id may be registered once.
     *
     * @throws ValidationException if the template is malformed, cyclic, names unknown agents or reuses an id
     */
    public WorkflowTemplate register(WorkflowTemplate template) {
        validate(template);
        if (templates.putIfAbsent(template.id(), template) != null) {
            throw new ValidationException("Template already registered: " + template.id());
        }
        log.info("Registered template '{}' ({} steps)", template.id(), template.steps().size());
        return template;
    }

    public Optional<WorkflowTemplate> find(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public WorkflowTemplate get(String templateId) {
        return find(templateId).orElseThrow(() -> new TemplateNotFoundException(templateId));
    }

    public List<TemplateSummary> list() {
        synchronized (templates) {
            return templates.values().stream().map(TemplateSummary::of).toList();
        }
    }

    void validate(WorkflowTemplate template) {
        if (template == null || template.id() == null || template.id().isBlank()) {
            throw new ValidationException("Template id must not be blank");
        }
        if (template.steps().isEmpty()) {
            throw new ValidationException("Template " + template.id() + " has no steps");
        }
        try {
            resolver.resolve(template.steps());
        } catch (ValidationException e) {
            throw new ValidationException("Template " + template.id() + ": " + e.getMessage());
        }
        List<String> unknown = agentCatalog.unresolvable(template.steps().stream().map(StepDefinition::agentId).toList());
        if (!unknown.isEmpty()) {
            throw new ValidationException("Template " + template.id() + " uses unknown agent(s): " + unknown);
        }
    }

    private void loadCatalogue(String location, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        if (location == null || location.isBlank()) {
            log.info("No template catalogue configured");
            return;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Template catalogue {} not found; starting with no templates", location);
            return;
        }
        Catalogue catalogue;
        try (InputStream in = resource.getInputStream()) {
            catalogue = objectMapper.readValue(in, Catalogue.class);
        } catch (IOException e) {
            log.error("Failed to read template catalogue {}: {}", location, e.getMessage(), e);
            return;
        }
        if (catalogue == null || catalogue.templates() == null) {
            log.warn("Template catalogue {} contains no templates", location);
            return;
        }
        for (WorkflowTemplate template : catalogue.templates()) {
            try {
                register(template);
            } catch (ValidationException e) {
                log.warn("Rejected template from {}: {}", location, e.getMessage());
            }
        }
        log.info("Loaded {} template(s) from {}", templates.size(), location);
    }
}
