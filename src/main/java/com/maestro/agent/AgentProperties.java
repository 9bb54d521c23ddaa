package com.maestro.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "maestro.agents")
public class AgentProperties {

    /** Base URL of the Agent Invocation Service; blank disables the HTTP client. */
    private String endpoint = "";
    private Duration connectTimeout = Duration.ofSeconds(10);
    /** When true, a directed mention is forwarded to the target agent and its answer attached. */
    private boolean respondToMentions = false;
    /** Resolvable agents. Empty means any non-blank agent id is accepted. */
    private List<Agent> known = new ArrayList<>();

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public boolean isRespondToMentions() { return respondToMentions; }
    public void setRespondToMentions(boolean respondToMentions) { this.respondToMentions = respondToMentions; }
    public List<Agent> getKnown() { return known; }
    public void setKnown(List<Agent> known) { this.known = known; }

    public boolean hasEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    public static class Agent {
        private String id = "";
        private String name = "";

        public Agent() {}

        public Agent(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
    }
}
