package com.maestro.core.model;

public class TemplateNotFoundException extends MaestroException {

    public TemplateNotFoundException(String templateId) {
        super("Template not found: " + templateId);
    }
}
