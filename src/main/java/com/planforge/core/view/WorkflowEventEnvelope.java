package com.planforge.core.view;

import com.planforge.core.model.WorkflowId;
import com.planforge.core.workflow.WorkflowEvent;

/**
 * A persisted event as broadcast to event subscribers.
 *
 * @param aggregateId workflow the event belongs to
 * @param sequence    position in that workflow's log
 * @param event       the event
 */
public record WorkflowEventEnvelope(WorkflowId aggregateId, long sequence, WorkflowEvent event) {
}
