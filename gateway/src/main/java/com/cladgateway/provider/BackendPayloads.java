package com.cladgateway.provider;

import com.cladgateway.exception.BackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses raw backend bodies regardless of the declared content type.
 */
@Slf4j
final class BackendPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BackendPayloads() {
    }

    static JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            log.error("Backend returned an empty body");
            throw new BackendException("Backend returned an empty body", null);
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse backend response: {}", e.getOriginalMessage());
            throw new BackendException("Failed to parse backend response: " + e.getOriginalMessage(), e);
        }
    }
}
