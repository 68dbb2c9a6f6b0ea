package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Exactly one of {@code result} and {@code error} is meaningful; {@code error} decides which.
 */
public record RpcResponse(String id, JsonNode result, RpcError error) {
    public static RpcResponse success(String id, JsonNode result) {
        return new RpcResponse(id, result == null ? NullNode.getInstance() : result, null);
    }

    public static RpcResponse failure(String id, int code, String message) {
        return new RpcResponse(id, null, new RpcError(code, message));
    }

    public boolean isError() {
        return error != null;
    }
}
