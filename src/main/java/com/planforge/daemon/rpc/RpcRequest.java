package com.planforge.daemon.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One call on the wire: a single JSON object on its own line.
 *
 * @param id     caller-chosen id echoed in the response
 * @param method method name, e.g. {@code register}
 * @param params named parameters, absent for methods without any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcRequest(long id, String method, JsonNode params) {

    /** Text parameter, or {@code null} when absent. */
    public String textParam(String name) {
        JsonNode node = params != null ? params.get(name) : null;
        return node != null && !node.isNull() ? node.asText() : null;
    }

    public JsonNode param(String name) {
        return params != null ? params.get(name) : null;
    }
}
