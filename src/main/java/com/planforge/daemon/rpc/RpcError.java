package com.planforge.daemon.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error half of a response.
 *
 * @param type        error kind, a {@code DaemonError} or {@code FileAccessError} name
 * @param message     human readable description
 * @param sessionId   session the error refers to, if any
 * @param existingPid owner of a conflicting registration, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcError(
        @JsonProperty("type") String type,
        @JsonProperty("message") String message,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("existingPid") Long existingPid) {

    public static RpcError of(String type, String message) {
        return new RpcError(type, message, null, null);
    }
}
