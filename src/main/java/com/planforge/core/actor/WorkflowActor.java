package com.planforge.core.actor;

import com.planforge.core.events.EventBus;
import com.planforge.core.events.LatestValue;
import com.planforge.core.logging.MdcContext;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.persistence.AggregateContext;
import com.planforge.core.persistence.FileEventStore;
import com.planforge.core.persistence.JsonSupport;
import com.planforge.core.persistence.StoredEvent;
import com.planforge.core.view.WorkflowEventEnvelope;
import com.planforge.core.view.WorkflowProjection;
import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowCommand;
import com.planforge.core.workflow.WorkflowData;
import com.planforge.core.workflow.WorkflowError;
import com.planforge.core.workflow.WorkflowEvent;
import com.planforge.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Single writer for one workflow.
 * <p>
 * Takes messages from its inbox one at a time. A command goes through aggregate validation,
 * store append, projection update and broadcast before the next message is looked at, so
 * the aggregate needs no locking. Rejections and storage errors are replied to the caller
 * and the actor carries on; anything else escapes {@link #run()} and ends this incarnation,
 * leaving the restart to {@link WorkflowSupervisor}.
 */
public class WorkflowActor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowActor.class);

    private final ActorArgs args;
    private final BlockingQueue<WorkflowMessage> inbox;
    private final LatestValue<WorkflowView> latest;
    private final EventBus<WorkflowEventEnvelope> events;
    private final PlanforgeMetrics metrics;

    private FileEventStore store;
    private AggregateContext context;
    private WorkflowProjection projection;

    WorkflowActor(ActorArgs args, BlockingQueue<WorkflowMessage> inbox, LatestValue<WorkflowView> latest,
                  EventBus<WorkflowEventEnvelope> events, PlanforgeMetrics metrics) {
        this.args = args;
        this.inbox = inbox;
        this.latest = latest;
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Loads state and processes messages until a stop message arrives.
     */
    void run() throws InterruptedException {
        initialize();
        while (true) {
            WorkflowMessage message = inbox.take();
            if (message instanceof WorkflowMessage.Stop) {
                log.debug("Workflow actor for {} stopping", args.workflowId());
                return;
            }
            if (message instanceof WorkflowMessage.GetView get) {
                get.reply().complete(projection.view());
            } else if (message instanceof WorkflowMessage.Execute execute) {
                handle(execute);
            }
        }
    }

    private void initialize() {
        store = new FileEventStore(args.logPath(), args.snapshotPath(), args.snapshotEvery(),
                JsonSupport.newObjectMapper(), args.clock());
        context = store.loadAggregate(args.workflowId());
        projection = new WorkflowProjection(args.workflowId());
        for (StoredEvent stored : store.loadEvents(args.workflowId())) {
            projection.applyEvent(stored.payload(), stored.sequence());
        }
        latest.set(projection.view());
        log.info("Workflow actor for {} ready at sequence {}", args.workflowId(), context.currentSequence());
    }

    private void handle(WorkflowMessage.Execute execute) {
        WorkflowCommand command = execute.command();
        WorkflowData data = context.aggregate().data();
        MdcContext.setCommand(args.workflowId().toString(), command.commandName(),
                data != null ? data.phaseLabel().name() : null);
        try {
            WorkflowView view = process(command);
            metrics.recordCommand(command.commandName(), "accepted");
            execute.reply().complete(view);
        } catch (WorkflowException e) {
            metrics.recordCommand(command.commandName(), e.error().name().toLowerCase());
            log.debug("Command {} failed: {}", command.commandName(), e.getMessage());
            execute.reply().completeExceptionally(e);
        } catch (RuntimeException | Error e) {
            execute.reply().completeExceptionally(WorkflowException.storageFailure(
                    "workflow actor failed while handling " + command.commandName(), e));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private WorkflowView process(WorkflowCommand command) {
        Instant now = args.clock().instant();
        List<WorkflowEvent> produced;
        try {
            produced = context.aggregate().handle(command, now);
        } catch (WorkflowException e) {
            throw e;
        } catch (RuntimeException e) {
            // handle has persisted nothing, so the actor state is still intact
            log.warn("Command {} could not be validated: {}", command.commandName(), e.toString());
            throw new WorkflowException(WorkflowError.INVALID_TRANSITION,
                    "command '" + command.commandName() + "' is malformed: " + e.getMessage(), e);
        }
        if (produced.isEmpty()) {
            return projection.view();
        }

        long started = System.currentTimeMillis();
        FileEventStore.CommitResult result;
        try {
            result = store.commit(context, produced, Map.of("command", command.commandName()));
        } catch (WorkflowException e) {
            if (e.error() == WorkflowError.CONCURRENCY_CONFLICT) {
                log.warn("Event log for {} moved on underneath this actor, reloading", args.workflowId());
                reload();
            }
            throw e;
        }
        metrics.recordAppend(result.events().size(), System.currentTimeMillis() - started);
        context = result.context();

        for (StoredEvent stored : result.events()) {
            projection.applyEvent(stored.payload(), stored.sequence());
            events.publish(new WorkflowEventEnvelope(args.workflowId(), stored.sequence(), stored.payload()));
        }
        WorkflowView view = projection.view();
        latest.set(view);
        return view;
    }

    private void reload() {
        context = store.loadAggregate(args.workflowId());
        for (StoredEvent stored : store.loadEvents(args.workflowId())) {
            if (stored.sequence() > projection.lastEventSequence()) {
                projection.applyEvent(stored.payload(), stored.sequence());
                events.publish(new WorkflowEventEnvelope(args.workflowId(), stored.sequence(), stored.payload()));
            }
        }
        latest.set(projection.view());
    }
}
