package com.planforge.core.actor;

import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowCommand;

import java.util.concurrent.CompletableFuture;

/**
 * Messages accepted by a workflow actor's inbox.
 */
interface WorkflowMessage {

    record Execute(WorkflowCommand command, CompletableFuture<WorkflowView> reply) implements WorkflowMessage {
    }

    record GetView(CompletableFuture<WorkflowView> reply) implements WorkflowMessage {
    }

    record Stop() implements WorkflowMessage {
    }
}
