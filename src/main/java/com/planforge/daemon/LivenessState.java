package com.planforge.daemon;

/**
 * Whether the process that owns a session is still alive, as judged by the daemon from
 * heartbeat recency. Independent of the workflow phase.
 */
public enum LivenessState {
    RUNNING,
    UNRESPONSIVE,
    /** Terminal. A stopped record is never reclassified by the sweep. */
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
