package com.planforge.core.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.planforge.core.workflow.WorkflowData;

import java.time.Instant;

/**
 * Aggregate state as of {@code sequence}. The whole file is replaced on every write.
 *
 * @param aggregateId workflow the state belongs to
 * @param sequence    last event folded into {@code state}
 * @param snapshotAt  when the snapshot was taken
 * @param state       workflow data, null for an uninitialized workflow
 */
public record StoredSnapshot(
        @JsonProperty("aggregate_id") String aggregateId,
        long sequence,
        @JsonProperty("snapshot_at") Instant snapshotAt,
        WorkflowData state
) {
}
