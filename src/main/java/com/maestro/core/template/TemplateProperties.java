package com.maestro.core.template;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "maestro.templates")
public class TemplateProperties {

    /** Spring resource location of the template catalogue; blank disables loading. */
    private String location = "classpath:workflows.json";

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
}
