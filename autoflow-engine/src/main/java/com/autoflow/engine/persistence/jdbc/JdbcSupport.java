package com.autoflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

/**
 * Conversions shared by the JDBC repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static String toJson(ObjectMapper objectMapper, Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    static JsonNode parseJson(ObjectMapper objectMapper, String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse stored JSON", e);
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static UUID toUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
