package com.planforge.daemon;

import java.nio.file.Path;

/**
 * File layout under the PlanForge home directory.
 */
public record DaemonPaths(Path home) {

    public Path daemonDir() {
        return home.resolve("daemon");
    }

    public Path registryFile() {
        return daemonDir().resolve("registry.json");
    }

    public Path portFile() {
        return daemonDir().resolve("sessiond.port");
    }

    public Path pidFile() {
        return daemonDir().resolve("sessiond.pid");
    }

    public Path buildShaFile() {
        return daemonDir().resolve("sessiond.sha");
    }

    public Path sessionsDir() {
        return home.resolve("sessions");
    }

    /** Directory of one session's files. Not created. */
    public Path sessionDir(String sessionId) {
        return sessionsDir().resolve(sessionId);
    }
}
