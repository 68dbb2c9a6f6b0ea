package io.mindmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Field access on RPC params. Missing or mistyped fields raise {@link IllegalArgumentException},
 * which the server answers with INVALID_PARAMS.
 */
final class Params {
    private Params() {
    }

    static String requireText(JsonNode params, String field) {
        JsonNode node = params == null ? null : params.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("'" + field + "' must be a non-empty string");
        }
        return node.asText().trim();
    }

    static String optText(JsonNode params, String field) {
        JsonNode node = params == null ? null : params.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("'" + field + "' must be a string");
        }
        return node.asText().isBlank() ? null : node.asText().trim();
    }

    static int requireInt(JsonNode params, String field) {
        JsonNode node = params == null ? null : params.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        return node.asInt();
    }

    static long optLong(JsonNode params, String field, long fallback) {
        JsonNode node = params == null ? null : params.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        return node.asLong();
    }

    static boolean optBoolean(JsonNode params, String field, boolean fallback) {
        JsonNode node = params == null ? null : params.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new IllegalArgumentException("'" + field + "' must be a boolean");
        }
        return node.asBoolean();
    }

    static List<String> textList(JsonNode params, String field) {
        JsonNode node = params == null ? null : params.get(field);
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array of strings");
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new IllegalArgumentException("'" + field + "' must be an array of strings");
            }
            if (!item.asText().isBlank()) {
                out.add(item.asText().trim());
            }
        }
        return out;
    }

    static JsonNode value(JsonNode params, String field) {
        JsonNode node = params == null ? null : params.get(field);
        return node == null ? NullNode.getInstance() : node;
    }
}
