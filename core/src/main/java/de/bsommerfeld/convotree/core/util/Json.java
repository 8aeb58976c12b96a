package de.bsommerfeld.convotree.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper for payload columns. {@link ObjectMapper} is
 * thread-safe once configured, so one instance serves the whole process.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static ArrayNode array() {
        return MAPPER.createArrayNode();
    }

    /** Serializes a node, mapping {@code null} to {@code null}. */
    public static String write(JsonNode node) {
        if (node == null)
            return null;
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON payload", e);
        }
    }

    /** Parses a column value, mapping {@code null} to {@code null}. */
    public static JsonNode read(String json) {
        if (json == null)
            return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON payload is not valid JSON", e);
        }
    }

    /**
     * Payload with a single block, the common shape for plain text messages:
     * {@code {"blocks":[{"type":"main_text","content":text}]}}.
     */
    public static ObjectNode textPayload(String text) {
        ObjectNode data = object();
        data.putArray("blocks").addObject().put("type", "main_text").put("content", text);
        return data;
    }
}
