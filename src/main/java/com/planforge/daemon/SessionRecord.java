package com.planforge.daemon;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of the daemon's session registry.
 *
 * @param sessionId       workflow id of the session
 * @param featureName     feature being worked on, for display
 * @param workingDir      directory the session runs in
 * @param statePath       path of the session's state (event log) file
 * @param phase           current phase label
 * @param iteration       current iteration
 * @param workflowStatus  workflow status string as reported by the owning process
 * @param liveness        daemon-computed liveness
 * @param updatedAt       time of the last state update
 * @param lastHeartbeatAt time of the last heartbeat
 * @param pid             process id of the owning process
 */
public record SessionRecord(
        @JsonProperty("workflow_session_id") String sessionId,
        @JsonProperty("feature_name") String featureName,
        @JsonProperty("working_dir") String workingDir,
        @JsonProperty("state_path") String statePath,
        @JsonProperty("phase") String phase,
        @JsonProperty("iteration") int iteration,
        @JsonProperty("workflow_status") String workflowStatus,
        @JsonProperty("liveness") LivenessState liveness,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("last_heartbeat_at") Instant lastHeartbeatAt,
        @JsonProperty("pid") long pid) {

    public static SessionRecord create(String sessionId, String featureName, String workingDir, String statePath,
                                       String phase, int iteration, String workflowStatus, long pid, Instant now) {
        return new SessionRecord(sessionId, featureName, workingDir, statePath, phase, iteration, workflowStatus,
                LivenessState.RUNNING, now, now, pid);
    }

    public SessionRecord withHeartbeat(Instant now) {
        return new SessionRecord(sessionId, featureName, workingDir, statePath, phase, iteration, workflowStatus,
                LivenessState.RUNNING, updatedAt, now, pid);
    }

    /**
     * Refreshes the progress fields. Counts as a heartbeat.
     */
    public SessionRecord withState(String newPhase, int newIteration, String newStatus, Instant now) {
        return new SessionRecord(sessionId, featureName, workingDir, statePath, newPhase, newIteration, newStatus,
                LivenessState.RUNNING, now, now, pid);
    }

    public SessionRecord withLiveness(LivenessState newLiveness) {
        return new SessionRecord(sessionId, featureName, workingDir, statePath, phase, iteration, workflowStatus,
                newLiveness, updatedAt, lastHeartbeatAt, pid);
    }

    /** Same record stamped as freshly seen at {@code now}. */
    public SessionRecord touched(Instant now) {
        return new SessionRecord(sessionId, featureName, workingDir, statePath, phase, iteration, workflowStatus,
                liveness == LivenessState.STOPPED ? LivenessState.STOPPED : LivenessState.RUNNING,
                now, now, pid);
    }
}
