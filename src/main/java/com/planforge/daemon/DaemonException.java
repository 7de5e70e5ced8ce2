package com.planforge.daemon;

/**
 * Failure of a session daemon operation. The same exception is raised on both sides of the
 * wire: the server turns it into an error response and the client re-raises it.
 */
public class DaemonException extends RuntimeException {

    private final DaemonError error;
    private final String sessionId;
    private final Long existingPid;

    public DaemonException(DaemonError error, String message) {
        this(error, message, null, null, null);
    }

    public DaemonException(DaemonError error, String message, Throwable cause) {
        this(error, message, null, null, cause);
    }

    public DaemonException(DaemonError error, String message, String sessionId, Long existingPid, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.sessionId = sessionId;
        this.existingPid = existingPid;
    }

    public static DaemonException sessionNotFound(String sessionId) {
        return new DaemonException(DaemonError.SESSION_NOT_FOUND, "session not found: " + sessionId,
                sessionId, null, null);
    }

    public static DaemonException alreadyRegistered(String sessionId, long existingPid) {
        return new DaemonException(DaemonError.ALREADY_REGISTERED,
                "session " + sessionId + " is already registered by live process " + existingPid,
                sessionId, existingPid, null);
    }

    public static DaemonException shuttingDown() {
        return new DaemonException(DaemonError.SHUTTING_DOWN, "daemon is shutting down");
    }

    public static DaemonException authenticationFailed() {
        return new DaemonException(DaemonError.AUTHENTICATION_FAILED, "authentication required");
    }

    public static DaemonException internal(String message, Throwable cause) {
        return new DaemonException(DaemonError.INTERNAL, message, cause);
    }

    public DaemonError error() {
        return error;
    }

    public String sessionId() {
        return sessionId;
    }

    public Long existingPid() {
        return existingPid;
    }
}
