package com.planforge.core.persistence;

import com.planforge.core.model.WorkflowId;
import com.planforge.core.workflow.WorkflowAggregate;

/**
 * A loaded aggregate together with the log position it reflects.
 * {@code currentSequence} is the expected last sequence for the next commit.
 *
 * @param aggregateId     workflow id
 * @param aggregate       state rebuilt from snapshot and log
 * @param currentSequence last persisted sequence, 0 for an empty log
 */
public record AggregateContext(WorkflowId aggregateId, WorkflowAggregate aggregate, long currentSequence) {

    public AggregateContext advancedTo(long sequence) {
        return new AggregateContext(aggregateId, aggregate, sequence);
    }
}
