package com.autoflow.triage.compiler;

import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;

/**
 * Payload helpers shared by the compilers.
 */
final class Payloads {

    private Payloads() {
    }

    /**
     * Start a payload with the fields every compiled action carries.
     */
    static ObjectNode base(TriageResult triage, TriggerEvent event) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("content", event.content());
        payload.put("category", triage.category().value());
        payload.put("urgency_score", triage.classification().urgencyScore());
        payload.set("matched_keywords", array(triage.classification().matchedKeywords()));
        return payload;
    }

    static ArrayNode array(Collection<String> values) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        values.forEach(array::add);
        return array;
    }

    /**
     * Read a string list from metadata, falling back to a single value.
     */
    static ArrayNode stringList(JsonNode metadata, String field, String fallback) {
        JsonNode node = metadata.path(field);
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        if (node.isArray()) {
            node.forEach(n -> array.add(n.asText()));
        } else if (node.isTextual() && !node.asText().isBlank()) {
            array.add(node.asText());
        }
        if (array.isEmpty() && fallback != null) {
            array.add(fallback);
        }
        return array;
    }

    /**
     * First line of the content, trimmed to a title length.
     */
    static String summary(String content, int maxLength) {
        if (content == null || content.isBlank()) {
            return "Untitled";
        }
        String firstLine = content.strip().lines().findFirst().orElse("").strip();
        return firstLine.length() <= maxLength ? firstLine : firstLine.substring(0, maxLength).strip();
    }
}
