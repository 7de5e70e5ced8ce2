package com.planforge.core.actor;

import com.planforge.core.model.WorkflowId;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Everything needed to construct a workflow actor. The supervisor reuses the same
 * instance for every restart.
 *
 * @param workflowId    workflow the actor drives
 * @param logPath       event log file
 * @param snapshotPath  snapshot file
 * @param snapshotEvery snapshot interval in events, 0 to disable
 * @param clock         source of event timestamps
 */
public record ActorArgs(WorkflowId workflowId, Path logPath, Path snapshotPath, int snapshotEvery, Clock clock) {

    public static final int DEFAULT_SNAPSHOT_EVERY = 50;

    public static ActorArgs inDirectory(WorkflowId workflowId, Path sessionStateDir) {
        return new ActorArgs(workflowId, sessionStateDir.resolve("events.jsonl"),
                sessionStateDir.resolve("snapshot.json"), DEFAULT_SNAPSHOT_EVERY, Clock.systemUTC());
    }
}
