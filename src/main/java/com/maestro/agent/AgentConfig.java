package com.maestro.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link AgentInvocationService} bean.
 * <p>
 * With {@code maestro.agents.endpoint} set, agents are called over HTTP. Otherwise a fallback
 * that fails every call is installed, so executions still run and end FAILED with a clear reason.
 */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    @Bean
    @ConditionalOnMissingBean(AgentInvocationService.class)
    public AgentInvocationService agentInvocationService(AgentProperties properties, ObjectMapper objectMapper) {
        if (properties.hasEndpoint()) {
            log.info("Invoking agents over HTTP at {}", properties.getEndpoint());
            return new HttpAgentInvocationService(properties, objectMapper);
        }
        log.warn("No agent endpoint configured; every step invocation will fail");
        return new UnconfiguredAgentInvocationService();
    }
}
