package com.planforge.core.actor;

import com.planforge.core.events.EventBus;
import com.planforge.core.events.LatestValue;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.view.WorkflowEventEnvelope;
import com.planforge.core.view.WorkflowProjection;
import com.planforge.core.view.WorkflowView;
import com.planforge.core.workflow.WorkflowCommand;
import com.planforge.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Keeps the actor of one workflow alive and is the handle callers talk to.
 * <p>
 * The supervisor owns the inbox and both output channels, so queued commands and existing
 * subscribers survive an actor restart. When an actor incarnation ends without being asked
 * to, the supervisor republishes a view rebuilt from the event log and spawns a fresh actor
 * with the same {@link ActorArgs}. It never touches actor state directly.
 */
public class WorkflowSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSupervisor.class);

    public static final int DEFAULT_MAX_RESTARTS = 5;

    private final ActorArgs args;
    private final PlanforgeMetrics metrics;
    private final int maxRestarts;
    private final Function<ActorArgs, WorkflowView> recoveryView;

    private final LinkedBlockingQueue<WorkflowMessage> inbox = new LinkedBlockingQueue<>();
    private final LatestValue<WorkflowView> latest;
    private final EventBus<WorkflowEventEnvelope> events;
    private final ExecutorService executor;
    private final AtomicInteger restarts = new AtomicInteger();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean stopping;
    private volatile boolean dead;
    private volatile String deathReason;

    private WorkflowSupervisor(ActorArgs args, PlanforgeMetrics metrics, int maxRestarts, int broadcastCapacity,
                               Function<ActorArgs, WorkflowView> recoveryView) {
        this.args = args;
        this.recoveryView = recoveryView;
        this.metrics = metrics;
        this.maxRestarts = maxRestarts;
        this.latest = new LatestValue<>(WorkflowView.empty(args.workflowId()));
        this.events = new EventBus<>(broadcastCapacity);
        String name = "workflow-actor-" + args.workflowId().toString().substring(0, 8);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public static WorkflowSupervisor start(ActorArgs args, PlanforgeMetrics metrics) {
        return start(args, metrics, DEFAULT_MAX_RESTARTS, EventBus.DEFAULT_CAPACITY);
    }

    public static WorkflowSupervisor start(ActorArgs args, PlanforgeMetrics metrics, int maxRestarts,
                                           int broadcastCapacity) {
        return start(args, metrics, maxRestarts, broadcastCapacity,
                a -> WorkflowProjection.bootstrapViewFromEvents(a.logPath(), a.workflowId()));
    }

    static WorkflowSupervisor start(ActorArgs args, PlanforgeMetrics metrics, int maxRestarts,
                                    int broadcastCapacity, Function<ActorArgs, WorkflowView> recoveryView) {
        var supervisor = new WorkflowSupervisor(args, metrics, maxRestarts, broadcastCapacity, recoveryView);
        supervisor.spawn();
        return supervisor;
    }

    private void spawn() {
        executor.execute(this::runIncarnation);
    }

    private void runIncarnation() {
        var actor = new WorkflowActor(args, inbox, latest, events, metrics);
        Throwable failure = null;
        try {
            actor.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (Throwable t) {
            failure = t;
        }
        try {
            onActorExit(failure);
        } catch (RuntimeException | Error e) {
            log.error("Supervision of {} failed", args.workflowId(), e);
            shutDown("workflow actor for " + args.workflowId() + " could not be supervised");
        }
    }

    private void onActorExit(Throwable failure) {
        if (stopping) {
            shutDown("workflow " + args.workflowId() + " was stopped");
            return;
        }
        int attempt = restarts.incrementAndGet();
        if (attempt > maxRestarts) {
            log.error("Workflow actor for {} failed {} times, giving up", args.workflowId(), attempt, failure);
            shutDown("workflow actor for " + args.workflowId() + " exceeded its restart limit");
            return;
        }
        log.warn("Workflow actor for {} terminated ({}), restarting ({}/{})", args.workflowId(),
                failure != null ? failure.toString() : "exited", attempt, maxRestarts, failure);
        metrics.incrementActorRestarts(failure != null ? failure.getClass().getSimpleName() : "exited");
        try {
            latest.set(recoveryView.apply(args));
        } catch (RuntimeException e) {
            log.warn("Could not rebuild the view of {} from its event log, keeping the last one",
                    args.workflowId(), e);
        }
        try {
            spawn();
        } catch (RuntimeException e) {
            log.error("Could not restart the workflow actor for {}", args.workflowId(), e);
            shutDown("workflow actor for " + args.workflowId() + " could not be restarted");
        }
    }

    private void shutDown(String reason) {
        deathReason = reason;
        dead = true;
        failPending();
        terminated.countDown();
        executor.shutdown();
    }

    private void failPending() {
        List<WorkflowMessage> pending = new ArrayList<>();
        inbox.drainTo(pending);
        for (WorkflowMessage message : pending) {
            WorkflowException error = WorkflowException.storageFailure(deathReason, null);
            if (message instanceof WorkflowMessage.Execute execute) {
                execute.reply().completeExceptionally(error);
            } else if (message instanceof WorkflowMessage.GetView get) {
                get.reply().completeExceptionally(error);
            }
        }
    }

    // -- Caller API ----------------------------------------------------------

    /**
     * Queues a command. The future completes with the view after the command's events are
     * persisted, or exceptionally with a {@link WorkflowException}. Use its timeout methods
     * to apply a deadline.
     */
    public CompletableFuture<WorkflowView> submit(WorkflowCommand command) {
        var reply = new CompletableFuture<WorkflowView>();
        if (dead || stopping) {
            reply.completeExceptionally(WorkflowException.storageFailure(
                    "workflow actor for " + args.workflowId() + " is not running", null));
            return reply;
        }
        inbox.add(new WorkflowMessage.Execute(command, reply));
        if (dead) {
            // lost the race with shutDown
            failPending();
        }
        return reply;
    }

    /**
     * Submits a command and waits for the result.
     *
     * @throws WorkflowException if the command is rejected or cannot be persisted
     */
    public WorkflowView execute(WorkflowCommand command) {
        try {
            return submit(command).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof WorkflowException workflowError) {
                throw workflowError;
            }
            throw e;
        }
    }

    /**
     * View after every message queued so far has been handled.
     */
    public CompletableFuture<WorkflowView> queryView() {
        var reply = new CompletableFuture<WorkflowView>();
        if (dead || stopping) {
            reply.complete(latest.get());
            return reply;
        }
        inbox.add(new WorkflowMessage.GetView(reply));
        if (dead) {
            failPending();
        }
        return reply;
    }

    /** Most recently published view, without waiting. */
    public WorkflowView currentView() {
        return latest.get();
    }

    public LatestValue<WorkflowView> watch() {
        return latest;
    }

    public EventBus.Subscription<WorkflowEventEnvelope> subscribeEvents() {
        return events.subscribe();
    }

    public ActorArgs args() {
        return args;
    }

    public int restartCount() {
        return restarts.get();
    }

    public boolean isRunning() {
        return !dead && !stopping;
    }

    /**
     * Lets the actor finish what is queued ahead of the stop request, then shuts it down.
     */
    public void stop() {
        if (stopping) {
            return;
        }
        stopping = true;
        inbox.add(new WorkflowMessage.Stop());
        try {
            if (!terminated.await(5, TimeUnit.SECONDS)) {
                log.warn("Workflow actor for {} did not stop in time, interrupting", args.workflowId());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
