package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.UUID;

public record RpcRequest(String id, String method, JsonNode params) {
    public RpcRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        params = params == null ? NullNode.getInstance() : params;
    }

    public static RpcRequest create(String method, JsonNode params) {
        return new RpcRequest(UUID.randomUUID().toString(), method, params);
    }
}
