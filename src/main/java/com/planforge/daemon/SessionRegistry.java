package com.planforge.daemon;

import com.planforge.core.metrics.PlanforgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The daemon's registry of sessions.
 * <p>
 * Every operation runs under one lock. Mutations are written to the {@link RegistryStore}
 * before the in-memory map changes and before the lock is released, so nobody can observe a
 * record whose disk write has not happened; a failed write leaves the registry unchanged.
 * Change listeners run after the lock is released.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionRecord> sessions = new LinkedHashMap<>();
    private final RegistryStore store;
    private final Clock clock;
    private final Supplier<LivenessThresholds> thresholds;
    private final PlanforgeMetrics metrics;
    private final CopyOnWriteArrayList<Consumer<SessionRecord>> listeners = new CopyOnWriteArrayList<>();

    private boolean shuttingDown;

    public SessionRegistry(RegistryStore store, Clock clock, Supplier<LivenessThresholds> thresholds,
                           PlanforgeMetrics metrics) {
        this.store = store;
        this.clock = clock;
        this.thresholds = thresholds;
        this.metrics = metrics;
    }

    /**
     * Creates a registry holding the persisted records, all marked {@link LivenessState#STOPPED}:
     * they describe sessions of an earlier daemon and are only revived by a new heartbeat or
     * registration.
     */
    public static SessionRegistry load(RegistryStore store, Clock clock, Supplier<LivenessThresholds> thresholds,
                                       PlanforgeMetrics metrics) {
        var registry = new SessionRegistry(store, clock, thresholds, metrics);
        for (SessionRecord record : store.load()) {
            registry.sessions.put(record.sessionId(), record.withLiveness(LivenessState.STOPPED));
        }
        log.info("Loaded {} session record(s) from {}", registry.sessions.size(), store.file());
        return registry;
    }

    /**
     * Registers a change listener, called with every record that was written or reclassified.
     */
    public void onChange(Consumer<SessionRecord> listener) {
        listeners.add(listener);
    }

    // -- Mutations -----------------------------------------------------------

    /**
     * Inserts or replaces a record, stamped as freshly seen.
     *
     * @throws DaemonException {@code ALREADY_REGISTERED} if a live record for the same session
     *                         belongs to another process
     */
    public SessionRecord register(SessionRecord record) {
        SessionRecord stored;
        lock.lock();
        try {
            ensureRunning();
            SessionRecord existing = sessions.get(record.sessionId());
            if (existing != null && existing.pid() != record.pid() && !existing.liveness().isTerminal()) {
                throw DaemonException.alreadyRegistered(record.sessionId(), existing.pid());
            }
            if (existing != null && existing.pid() != record.pid()) {
                log.info("Replacing stopped session {} (old pid {}, new pid {})",
                        record.sessionId(), existing.pid(), record.pid());
            }
            stored = record.withLiveness(LivenessState.RUNNING).touched(now());
            write(stored);
        } finally {
            lock.unlock();
        }
        log.debug("Registered session {} (pid {})", stored.sessionId(), stored.pid());
        notifyListeners(stored);
        return stored;
    }

    /**
     * Refreshes a record owned by the same process, or inserts it when unknown. A record owned
     * by another process is left as it is.
     */
    public SessionRecord update(SessionRecord record) {
        SessionRecord result;
        lock.lock();
        try {
            ensureRunning();
            SessionRecord existing = sessions.get(record.sessionId());
            if (existing == null) {
                result = record.touched(now());
                write(result);
            } else if (existing.pid() == record.pid()) {
                result = existing.withState(record.phase(), record.iteration(), record.workflowStatus(), now());
                if (record.liveness() == LivenessState.STOPPED) {
                    result = result.withLiveness(LivenessState.STOPPED);
                }
                write(result);
            } else {
                log.debug("Ignoring update for {} from pid {}, owned by pid {}",
                        record.sessionId(), record.pid(), existing.pid());
                result = existing;
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(result);
        return result;
    }

    /**
     * Records a heartbeat, which also brings the session back to {@link LivenessState#RUNNING}.
     */
    public SessionRecord heartbeat(String sessionId) {
        SessionRecord updated;
        lock.lock();
        try {
            ensureRunning();
            SessionRecord existing = sessions.get(sessionId);
            if (existing == null) {
                throw DaemonException.sessionNotFound(sessionId);
            }
            updated = existing.withHeartbeat(now());
            write(updated);
        } finally {
            lock.unlock();
        }
        notifyListeners(updated);
        return updated;
    }

    public SessionRecord forceStop(String sessionId) {
        SessionRecord stopped;
        lock.lock();
        try {
            ensureRunning();
            SessionRecord existing = sessions.get(sessionId);
            if (existing == null) {
                throw DaemonException.sessionNotFound(sessionId);
            }
            stopped = existing.withLiveness(LivenessState.STOPPED);
            write(stopped);
        } finally {
            lock.unlock();
        }
        log.info("Force-stopped session {}", sessionId);
        notifyListeners(stopped);
        return stopped;
    }

    // -- Queries -------------------------------------------------------------

    /**
     * Sweeps liveness, then returns every record in registration order.
     */
    public List<SessionRecord> list() {
        sweep();
        lock.lock();
        try {
            return List.copyOf(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    public Optional<SessionRecord> get(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    // -- Liveness ------------------------------------------------------------

    /**
     * Reclassifies every record that is not stopped from the age of its last heartbeat.
     * Thresholds are fetched once per sweep. Liveness only degrades here; recovering to
     * {@link LivenessState#RUNNING} takes a heartbeat.
     *
     * @return the records whose liveness changed
     */
    public List<SessionRecord> sweep() {
        List<SessionRecord> changed = new ArrayList<>();
        lock.lock();
        try {
            LivenessThresholds current = thresholds.get();
            Instant now = now();
            for (SessionRecord record : sessions.values()) {
                if (record.liveness().isTerminal() || record.lastHeartbeatAt() == null) {
                    continue;
                }
                LivenessState next = current.classify(Duration.between(record.lastHeartbeatAt(), now));
                if (next.ordinal() > record.liveness().ordinal()) {
                    changed.add(record.withLiveness(next));
                }
            }
            if (!changed.isEmpty()) {
                Map<String, SessionRecord> next = new LinkedHashMap<>(sessions);
                changed.forEach(r -> next.put(r.sessionId(), r));
                store.save(next.values());
                sessions.putAll(next);
            }
        } finally {
            lock.unlock();
        }
        for (SessionRecord record : changed) {
            log.info("Session {} is now {}", record.sessionId(), record.liveness());
            if (metrics != null) {
                metrics.recordLivenessTransition(record.liveness().name());
            }
            notifyListeners(record);
        }
        return changed;
    }

    // -- Shutdown ------------------------------------------------------------

    /**
     * Refuses further mutations and writes the registry one last time.
     */
    public void beginShutdown() {
        lock.lock();
        try {
            shuttingDown = true;
            store.save(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }

    // -- Internals -----------------------------------------------------------

    private void ensureRunning() {
        if (shuttingDown) {
            throw DaemonException.shuttingDown();
        }
    }

    /** Must hold the lock. Persists first so a failed write leaves memory untouched. */
    private void write(SessionRecord record) {
        Map<String, SessionRecord> next = new LinkedHashMap<>(sessions);
        next.put(record.sessionId(), record);
        store.save(next.values());
        sessions.put(record.sessionId(), record);
    }

    private Instant now() {
        return clock.instant();
    }

    private void notifyListeners(SessionRecord record) {
        for (Consumer<SessionRecord> listener : listeners) {
            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                log.warn("Session change listener failed for {}: {}", record.sessionId(), e.getMessage(), e);
            }
        }
    }
}
