package io.mindmesh.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    // Wire payloads and audit lines stay on one line.
    private static final ObjectMapper COMPACT = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final ObjectReader STRICT_TREE = COMPACT.reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper compact() {
        return COMPACT;
    }

    public static ObjectNode object() {
        return COMPACT.createObjectNode();
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static String toCompactJson(Object value) {
        try {
            return COMPACT.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize JSON", e);
        }
    }

    public static JsonNode toTree(Object value) {
        return COMPACT.valueToTree(value);
    }

    public static <T> T convert(JsonNode node, Class<T> type) {
        return COMPACT.convertValue(node, type);
    }

    /**
     * Parses operator input: a complete JSON document is kept as-is, anything else (including
     * JSON followed by more text, or blank input) becomes a JSON string.
     */
    public static JsonNode parseLenient(String raw) {
        if (raw == null) {
            return COMPACT.nullNode();
        }
        try {
            JsonNode node = STRICT_TREE.readTree(raw);
            return node == null || node.isMissingNode() ? COMPACT.getNodeFactory().textNode(raw) : node;
        } catch (JsonProcessingException e) {
            return COMPACT.getNodeFactory().textNode(raw);
        }
    }
}
