package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named RPC method. Throwing {@link IllegalArgumentException} reports invalid params; a
 * {@link io.mindmesh.error.RpcRemoteException} reports its own code; anything else is an internal error.
 */
@FunctionalInterface
public interface RpcHandler {
    JsonNode handle(JsonNode params) throws Exception;
}
