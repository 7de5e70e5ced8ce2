package com.planforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PlanForge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setCommand(String sessionId, String command, String phase) {
        MDC.put("sessionId", sessionId);
        MDC.put("command", command);
        if (phase != null) {
            MDC.put("phase", phase);
        }
    }

    public static void setRpc(String method, String connection) {
        MDC.put("rpcMethod", method);
        MDC.put("connection", connection);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("command");
        MDC.remove("phase");
        MDC.remove("rpcMethod");
        MDC.remove("connection");
    }
}
