package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.error.MalformedRequestException;
import io.mindmesh.error.ProtocolException;
import io.mindmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Request/response envelopes carried inside frames.
 *
 * <pre>
 * request  {"id": string, "method": string, "params": any}
 * response {"id": string, "result": any}
 *        | {"id": string, "error": {"code": int, "message": string}}
 * </pre>
 */
public final class RpcCodec {
    private static final ObjectMapper MAPPER = Jsons.compact();

    private RpcCodec() {
    }

    public static byte[] encodeRequest(RpcRequest request) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", request.id());
        node.put("method", request.method());
        node.set("params", request.params());
        return write(node);
    }

    public static byte[] encodeResponse(RpcResponse response) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", response.id());
        if (response.isError()) {
            ObjectNode error = node.putObject("error");
            error.put("code", response.error().code());
            error.put("message", response.error().message());
        } else {
            node.set("result", response.result());
        }
        return write(node);
    }

    /**
     * @throws ProtocolException when the payload is not a JSON object with an id; the connection cannot continue
     * @throws MalformedRequestException when the id is present but the method is not
     */
    public static RpcRequest decodeRequest(byte[] payload) {
        JsonNode root = read(payload, "request");
        String id = textField(root, "id");
        if (id == null) {
            throw new ProtocolException("request envelope has no id");
        }
        String method = textField(root, "method");
        if (method == null || method.isBlank()) {
            throw new MalformedRequestException(id, "request envelope has no method");
        }
        return new RpcRequest(id, method, root.get("params"));
    }

    public static RpcResponse decodeResponse(byte[] payload) {
        JsonNode root = read(payload, "response");
        String id = textField(root, "id");
        if (id == null) {
            throw new ProtocolException("response envelope has no id");
        }
        JsonNode error = root.get("error");
        if (error != null && error.isObject()) {
            return RpcResponse.failure(id, error.path("code").asInt(RpcErrorCodes.INTERNAL_ERROR), error.path("message").asText(""));
        }
        if (!root.has("result")) {
            throw new ProtocolException("response envelope " + id + " has neither result nor error");
        }
        return RpcResponse.success(id, root.get("result"));
    }

    private static JsonNode read(byte[] payload, String what) {
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new ProtocolException("undecodable " + what + " envelope: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(what + " envelope is not a JSON object");
        }
        return root;
    }

    private static String textField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }

    private static byte[] write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProtocolException("failed to encode envelope", e);
        }
    }
}
