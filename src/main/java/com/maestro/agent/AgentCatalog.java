package com.maestro.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of agents a step may be bound to.
 * <p>
 * When no agents are configured the catalogue is <em>open</em>: every non-blank agent id
 * resolves, and the Agent Invocation Service is the authority on whether it exists.
 */
@Service
public class AgentCatalog {

    private static final Logger log = LoggerFactory.getLogger(AgentCatalog.class);

    /** Agent id to display name, in configuration order. */
    private final Map<String, String> agents = new LinkedHashMap<>();

    public AgentCatalog(AgentProperties properties) {
        for (var agent : properties.getKnown()) {
            if (agent.getId() == null || agent.getId().isBlank()) {
                log.warn("Ignoring configured agent without an id (name='{}')", agent.getName());
                continue;
            }
            String name = agent.getName() == null || agent.getName().isBlank() ? agent.getId() : agent.getName();
            agents.put(agent.getId(), name);
        }
        if (agents.isEmpty()) {
            log.info("No agents configured; accepting any agent id");
        } else {
            log.info("Agent catalog: {}", agents.keySet());
        }
    }

    public boolean isOpen() {
        return agents.isEmpty();
    }

    public boolean isResolvable(String agentId) {
        if (agentId == null || agentId.isBlank()) return false;
        return isOpen() || agents.containsKey(agentId);
    }

    /** Returns the ids among {@code agentIds} that cannot be resolved, preserving order. */
    public List<String> unresolvable(Collection<String> agentIds) {
        var missing = new ArrayList<String>();
        for (String id : agentIds) {
            if (!isResolvable(id) && !missing.contains(String.valueOf(id))) {
                missing.add(String.valueOf(id));
            }
        }
        return missing;
    }

    public Optional<String> displayName(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<String> agentIds() {
        return List.copyOf(agents.keySet());
    }

    /**
     * Builds the lookup used for mention matching: normalized id or display name to agent id.
     * {@code extraIds} (typically the agents taking part in an execution) are added as well.
     */
    public Map<String, String> nameVariants(Collection<String> extraIds) {
        var variants = new LinkedHashMap<String, String>();
        agents.forEach((id, name) -> {
            variants.putIfAbsent(normalize(id), id);
            variants.putIfAbsent(normalize(name), id);
        });
        for (String id : extraIds) {
            if (id != null && !id.isBlank()) {
                variants.putIfAbsent(normalize(id), id);
            }
        }
        return variants;
    }

    static String normalize(String name) {
        return name.replace(" ", "").toLowerCase();
    }
}
