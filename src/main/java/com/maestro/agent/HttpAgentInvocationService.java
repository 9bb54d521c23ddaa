package com.maestro.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link AgentInvocationService} backed by an HTTP endpoint.
 *
 * <p>Sends {@code POST {endpoint}/agents/{agentId}/invoke} with
 * {@code {"task": ..., "context": {...}, "timeout_seconds": n}} and expects
 * {@code {"success": true, "output": "..."}} or {@code {"success": false, "error": "..."}}.
 * Non-2xx responses and transport errors are reported as failed invocations.
 */
public class HttpAgentInvocationService implements AgentInvocationService {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentInvocationService.class);

    private final String endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpAgentInvocationService(AgentProperties properties, ObjectMapper objectMapper) {
        this(properties.getEndpoint(), HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build(), objectMapper);
    }

    HttpAgentInvocationService(String endpoint, HttpClient httpClient, ObjectMapper objectMapper) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentInvocation invoke(String agentId, String taskText, Map<String, Object> context, Duration timeout) {
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("task", taskText);
            payload.set("context", objectMapper.valueToTree(context));
            payload.put("timeout_seconds", Math.max(1, timeout.toSeconds()));
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException | IllegalArgumentException e) {
            return AgentInvocation.failure("Could not serialize request for agent " + agentId + ": " + e.getMessage());
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/agents/" + URLEncoder.encode(agentId, StandardCharsets.UTF_8) + "/invoke"))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("Agent endpoint returned HTTP {} for {}", response.statusCode(), agentId);
                return AgentInvocation.failure("HTTP " + response.statusCode() + ": " + response.body());
            }
            return parse(response.body());
        } catch (IOException e) {
            return AgentInvocation.failure("Agent endpoint unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AgentInvocation.failure("Interrupted while calling agent " + agentId);
        }
    }

    AgentInvocation parse(String body) throws IOException {
        JsonNode json = objectMapper.readTree(body);
        if (json == null || !json.isObject()) {
            return AgentInvocation.failure("Malformed agent response");
        }
        boolean success = json.path("success").asBoolean(false);
        if (success) {
            return AgentInvocation.success(json.path("output").asText(""));
        }
        return AgentInvocation.failure(json.path("error").asText("Agent reported failure"));
    }
}
