package com.planforge.daemon.rpc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Answer to an {@link RpcRequest}; carries either a result or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcResponse(long id, JsonNode result, RpcError error) {

    public static RpcResponse success(long id, JsonNode result) {
        return new RpcResponse(id, result, null);
    }

    public static RpcResponse failure(long id, RpcError error) {
        return new RpcResponse(id, null, error);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
