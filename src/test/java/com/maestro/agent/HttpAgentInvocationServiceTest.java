package com.maestro.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HttpAgentInvocationServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = mock(HttpClient.class);
    private final HttpAgentInvocationService service =
            new HttpAgentInvocationService("http://agents.local/", httpClient, objectMapper);

    @Test
    @DisplayName("parses a successful response")
    void parseSuccess() throws IOException {
        var invocation = service.parse("{\"success\": true, \"output\": \"report ready\"}");
        assertTrue(invocation.success());
        assertEquals("report ready", invocation.output());
    }

    @Test
    @DisplayName("parses a reported failure")
    void parseFailure() throws IOException {
        var invocation = service.parse("{\"success\": false, \"error\": \"quota exceeded\"}");
        assertFalse(invocation.success());
        assertEquals("quota exceeded", invocation.error());
    }

    @Test
    @DisplayName("non-object bodies are malformed")
    void parseMalformed() throws IOException {
        assertFalse(service.parse("[1,2]").success());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("posts the task to the agent's invoke endpoint")
    void postsToAgentEndpoint() throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"success\": true, \"output\": \"ok\"}");
        var captured = new HttpRequest[1];
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenAnswer(inv -> {
            captured[0] = inv.getArgument(0);
            return response;
        });

        var invocation = service.invoke("research bot", "find data", Map.of("topic", "x"), Duration.ofSeconds(30));

        assertTrue(invocation.success());
        assertEquals("http://agents.local/agents/research+bot/invoke", captured[0].uri().toString());
        assertEquals("POST", captured[0].method());
        assertEquals(Duration.ofSeconds(30), captured[0].timeout().orElseThrow());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("non-2xx responses are failed invocations")
    void httpErrorIsFailure() throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(503);
        when(response.body()).thenReturn("busy");
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

        var invocation = service.invoke("writer", "t", Map.of(), Duration.ofSeconds(1));

        assertFalse(invocation.success());
        assertEquals("HTTP 503: busy", invocation.error());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("transport errors are failed invocations")
    void transportErrorIsFailure() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new ConnectException("refused"));

        var invocation = service.invoke("writer", "t", Map.of(), Duration.ofSeconds(1));

        assertFalse(invocation.success());
        assertTrue(invocation.error().contains("refused"));
    }
}
