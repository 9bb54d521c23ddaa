package com.maestro.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/communications/{id}/response.
 */
public record ResponseRequest(String response) {}
