package com.planforge.daemon;

import com.planforge.core.actor.WorkflowSupervisor;
import com.planforge.core.view.WorkflowView;
import com.planforge.daemon.rpc.DaemonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the daemon informed about the workflows running in this process.
 * <p>
 * A tracked workflow is registered once, updated whenever its view changes and heartbeated on
 * a fixed schedule. When the daemon cannot be reached the tracker drops its connection,
 * reconnects on a later tick and registers every tracked session again. Daemon errors never
 * reach the workflow.
 */
public class SessionTracker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(500);

    /** Opens an authenticated connection to the daemon. */
    @FunctionalInterface
    public interface Connector {
        DaemonClient connect() throws IOException;
    }

    private final Connector connector;
    private final Clock clock;
    private final long pid = ProcessHandle.current().pid();
    private final Map<String, Tracked> tracked = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-tracker");
        t.setDaemon(true);
        return t;
    });

    private DaemonClient client;
    private int consecutiveFailures;

    public SessionTracker(Connector connector, Clock clock, Duration heartbeatInterval) {
        this.connector = connector;
        this.clock = clock;
        long millis = heartbeatInterval.toMillis();
        heartbeats.scheduleAtFixedRate(this::heartbeatAll, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Registers the workflow with the daemon and follows its view from now on.
     */
    public void track(WorkflowSupervisor supervisor) {
        String sessionId = supervisor.args().workflowId().toString();
        String statePath = supervisor.args().logPath().toString();
        Runnable unsubscribe = supervisor.watch().onChange(view -> onViewChanged(sessionId, statePath, view));
        tracked.put(sessionId, new Tracked(statePath, unsubscribe, supervisor.currentView()));
        SessionRecord record = toRecord(sessionId, statePath, supervisor.currentView());
        withClient("register " + sessionId, c -> c.register(record));
    }

    /**
     * Stops following a workflow and reports it as stopped.
     */
    public void untrack(String sessionId) {
        Tracked removed = tracked.remove(sessionId);
        if (removed == null) {
            return;
        }
        removed.unsubscribe.run();
        SessionRecord stopped = toRecord(sessionId, removed.statePath, removed.lastView)
                .withLiveness(LivenessState.STOPPED);
        withClient("stop " + sessionId, c -> c.update(stopped));
    }

    public List<String> trackedSessions() {
        return List.copyOf(tracked.keySet());
    }

    private void onViewChanged(String sessionId, String statePath, WorkflowView view) {
        Tracked entry = tracked.get(sessionId);
        if (entry == null) {
            return;
        }
        entry.lastView = view;
        SessionRecord record = toRecord(sessionId, statePath, view);
        // off the actor thread, in order with heartbeats
        heartbeats.execute(() -> withClient("update " + sessionId, c -> c.update(record)));
    }

    SessionRecord toRecord(String sessionId, String statePath, WorkflowView view) {
        String phase = view.phase() != null ? view.phase().fullLabel() : "Uninitialized";
        int iteration = view.iteration() != null ? view.iteration().value() : 0;
        return SessionRecord.create(sessionId,
                view.featureName() != null ? view.featureName().value() : "",
                view.workingDir() != null ? view.workingDir().value() : "",
                statePath, phase, iteration, view.statusLine(), pid, clock.instant());
    }

    private void heartbeatAll() {
        if (tracked.isEmpty()) {
            consecutiveFailures = 0;
            return;
        }
        synchronized (this) {
            boolean reconnected = client == null;
            if (!ensureConnected()) {
                return;
            }
            try {
                if (reconnected) {
                    for (Map.Entry<String, Tracked> entry : tracked.entrySet()) {
                        Tracked t = entry.getValue();
                        client.register(toRecord(entry.getKey(), t.statePath, t.lastView));
                    }
                }
                for (String sessionId : tracked.keySet()) {
                    client.heartbeat(sessionId);
                }
                consecutiveFailures = 0;
            } catch (DaemonException e) {
                failed("heartbeat", e);
            }
        }
    }

    private synchronized void withClient(String what, ClientCall call) {
        if (!ensureConnected()) {
            return;
        }
        try {
            call.apply(client);
        } catch (DaemonException e) {
            failed(what, e);
        }
    }

    private boolean ensureConnected() {
        if (client != null) {
            return true;
        }
        try {
            client = connector.connect();
            consecutiveFailures = 0;
            log.debug("Connected to session daemon");
            return true;
        } catch (IOException | DaemonException e) {
            consecutiveFailures++;
            if (consecutiveFailures == 1) {
                log.warn("Session daemon unreachable: {}", e.getMessage());
            }
            return false;
        }
    }

    private void failed(String what, DaemonException e) {
        consecutiveFailures++;
        if (e.error() == DaemonError.ALREADY_REGISTERED) {
            log.warn("Daemon refused {}: {}", what, e.getMessage());
            return;
        }
        log.debug("Daemon call {} failed, reconnecting later: {}", what, e.getMessage());
        client.close();
        client = null;
    }

    @Override
    public void close() {
        for (String sessionId : List.copyOf(tracked.keySet())) {
            untrack(sessionId);
        }
        heartbeats.shutdownNow();
        synchronized (this) {
            if (client != null) {
                client.close();
                client = null;
            }
        }
    }

    @FunctionalInterface
    private interface ClientCall {
        void apply(DaemonClient client);
    }

    private static final class Tracked {
        private final String statePath;
        private final Runnable unsubscribe;
        private volatile WorkflowView lastView;

        private Tracked(String statePath, Runnable unsubscribe, WorkflowView lastView) {
            this.statePath = statePath;
            this.unsubscribe = unsubscribe;
            this.lastView = lastView;
        }
    }
}
