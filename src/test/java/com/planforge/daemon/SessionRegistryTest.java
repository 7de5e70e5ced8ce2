package com.planforge.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.persistence.JsonSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private RegistryStore store;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        meterRegistry = new SimpleMeterRegistry();
        store = new RegistryStore(tempDir.resolve("daemon").resolve("registry.json"), objectMapper);
        registry = newRegistry(store);
    }

    private SessionRegistry newRegistry(RegistryStore target) {
        return new SessionRegistry(target, clock, () -> LivenessThresholds.DEFAULT,
                new PlanforgeMetrics(meterRegistry));
    }

    private SessionRecord record(String id, long pid) {
        return SessionRecord.create(id, "audit", "/work", "/state/" + id, "Planning", 1, "Planning #1", pid,
                clock.instant());
    }

    // -- Registration ----------------------------------------------------------

    @Nested
    class Registration {

        @Test
        @DisplayName("register stores a running record and persists it")
        void registerPersists() {
            SessionRecord stored = registry.register(record("s-1", 100));

            assertEquals(LivenessState.RUNNING, stored.liveness());
            assertEquals(START, stored.lastHeartbeatAt());
            assertEquals(List.of(stored), store.load());
        }

        @Test
        @DisplayName("a live session cannot be claimed by another process")
        void alreadyRegistered() {
            registry.register(record("s-1", 100));

            var ex = assertThrows(DaemonException.class, () -> registry.register(record("s-1", 200)));

            assertEquals(DaemonError.ALREADY_REGISTERED, ex.error());
            assertEquals(100L, ex.existingPid());
            assertEquals("s-1", ex.sessionId());
            assertEquals(100, registry.get("s-1").orElseThrow().pid());
        }

        @Test
        @DisplayName("the same process may register again")
        void reRegisterSamePid() {
            registry.register(record("s-1", 100));
            clock.advance(Duration.ofSeconds(5));

            SessionRecord again = registry.register(record("s-1", 100));

            assertEquals(START.plusSeconds(5), again.lastHeartbeatAt());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("a stopped session can be taken over by a new process")
        void takeOverStopped() {
            registry.register(record("s-1", 100));
            registry.forceStop("s-1");

            SessionRecord stored = registry.register(record("s-1", 200));

            assertEquals(200, stored.pid());
            assertEquals(LivenessState.RUNNING, stored.liveness());
        }

        @Test
        @DisplayName("update from another process leaves the record alone")
        void updateFromForeignPid() {
            registry.register(record("s-1", 100));
            SessionRecord foreign = SessionRecord.create("s-1", "audit", "/work", "/state", "Reviewing", 2,
                    "Reviewing #2", 200, clock.instant());

            SessionRecord result = registry.update(foreign);

            assertEquals(100, result.pid());
            assertEquals("Planning", result.phase());
        }

        @Test
        @DisplayName("update refreshes phase and counts as a heartbeat")
        void updateRefreshes() {
            registry.register(record("s-1", 100));
            clock.advance(Duration.ofSeconds(30));
            registry.sweep();
            SessionRecord progressed = SessionRecord.create("s-1", "audit", "/work", "/state/s-1", "Reviewing", 1,
                    "Reviewing #1", 100, clock.instant());

            SessionRecord result = registry.update(progressed);

            assertEquals("Reviewing", result.phase());
            assertEquals(LivenessState.RUNNING, result.liveness());
            assertEquals(START.plusSeconds(30), result.lastHeartbeatAt());
        }

        @Test
        @DisplayName("heartbeat and forceStop of an unknown session fail with SESSION_NOT_FOUND")
        void unknownSession() {
            assertEquals(DaemonError.SESSION_NOT_FOUND,
                    assertThrows(DaemonException.class, () -> registry.heartbeat("nope")).error());
            assertEquals(DaemonError.SESSION_NOT_FOUND,
                    assertThrows(DaemonException.class, () -> registry.forceStop("nope")).error());
        }

        @Test
        @DisplayName("listeners see every write")
        void listenersNotified() {
            List<SessionRecord> seen = new ArrayList<>();
            registry.onChange(seen::add);

            registry.register(record("s-1", 100));
            registry.heartbeat("s-1");
            registry.forceStop("s-1");

            assertEquals(3, seen.size());
            assertEquals(LivenessState.STOPPED, seen.get(2).liveness());
        }

        @Test
        @DisplayName("a failing listener does not break the registry")
        void failingListener() {
            registry.onChange(r -> {
                throw new IllegalStateException("boom");
            });

            assertDoesNotThrow(() -> registry.register(record("s-1", 100)));
            assertEquals(1, registry.size());
        }
    }

    // -- Liveness --------------------------------------------------------------

    @Nested
    class Liveness {

        @Test
        @DisplayName("sessions go unresponsive after 25s and stopped after 60s")
        void degradesWithAge() {
            registry.register(record("s-1", 100));

            clock.advance(Duration.ofSeconds(25));
            assertTrue(registry.sweep().isEmpty());

            clock.advance(Duration.ofSeconds(1));
            List<SessionRecord> changed = registry.sweep();
            assertEquals(1, changed.size());
            assertEquals(LivenessState.UNRESPONSIVE, changed.get(0).liveness());

            clock.advance(Duration.ofSeconds(35));
            assertEquals(LivenessState.STOPPED, registry.sweep().get(0).liveness());
            assertEquals(LivenessState.STOPPED, registry.get("s-1").orElseThrow().liveness());

            assertEquals(1.0, meterRegistry.find("planforge.daemon.liveness.transitions")
                    .tag("liveness", "STOPPED").counter().count());
        }

        @Test
        @DisplayName("list sweeps before answering")
        void listSweeps() {
            registry.register(record("s-1", 100));
            clock.advance(Duration.ofSeconds(61));

            assertEquals(LivenessState.STOPPED, registry.list().get(0).liveness());
        }

        @Test
        @DisplayName("a stopped record is never reclassified by the sweep")
        void stoppedIsTerminal() {
            registry.register(record("s-1", 100));
            registry.forceStop("s-1");
            clock.advance(Duration.ofSeconds(120));

            assertTrue(registry.sweep().isEmpty());
            assertEquals(LivenessState.STOPPED, registry.get("s-1").orElseThrow().liveness());
        }

        @Test
        @DisplayName("a heartbeat brings an unresponsive session back to running")
        void heartbeatRecovers() {
            registry.register(record("s-1", 100));
            clock.advance(Duration.ofSeconds(30));
            registry.sweep();

            SessionRecord revived = registry.heartbeat("s-1");

            assertEquals(LivenessState.RUNNING, revived.liveness());
            assertEquals(START.plusSeconds(30), revived.lastHeartbeatAt());
        }

        @Test
        @DisplayName("thresholds are fetched on every sweep")
        void thresholdsReadPerSweep() {
            var limits = new ArrayList<LivenessThresholds>(List.of(LivenessThresholds.DEFAULT));
            var tunable = new SessionRegistry(store, clock, () -> limits.get(0), null);
            tunable.register(record("s-1", 100));
            clock.advance(Duration.ofSeconds(10));
            assertTrue(tunable.sweep().isEmpty());

            limits.set(0, LivenessThresholds.ofSeconds(5, 60));

            assertEquals(LivenessState.UNRESPONSIVE, tunable.sweep().get(0).liveness());
        }
    }

    // -- Persistence -----------------------------------------------------------

    @Nested
    class Persistence {

        @Test
        @DisplayName("records survive a reload and come back stopped")
        void loadMarksStopped() {
            registry.register(record("s-1", 100));
            registry.register(record("s-2", 101));

            SessionRegistry reloaded = SessionRegistry.load(store, clock, () -> LivenessThresholds.DEFAULT, null);

            assertEquals(List.of("s-1", "s-2"), reloaded.list().stream().map(SessionRecord::sessionId).toList());
            assertTrue(reloaded.list().stream().allMatch(r -> r.liveness() == LivenessState.STOPPED));
        }

        @Test
        @DisplayName("an unreadable registry file loads as empty")
        void corruptFile() throws Exception {
            Files.createDirectories(store.file().getParent());
            Files.writeString(store.file(), "{not json");

            assertEquals(0, SessionRegistry.load(store, clock, () -> LivenessThresholds.DEFAULT, null).size());
        }

        @Test
        @DisplayName("a failed write leaves the registry unchanged")
        void failedWrite() throws Exception {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "not a directory");
            SessionRegistry broken = newRegistry(new RegistryStore(blocker.resolve("registry.json"), objectMapper));

            var ex = assertThrows(DaemonException.class, () -> broken.register(record("s-1", 100)));

            assertEquals(DaemonError.INTERNAL, ex.error());
            assertEquals(0, broken.size());
        }

        @Test
        @DisplayName("after beginShutdown mutations fail with SHUTTING_DOWN")
        void shuttingDown() {
            registry.register(record("s-1", 100));

            registry.beginShutdown();

            assertTrue(registry.isShuttingDown());
            assertEquals(DaemonError.SHUTTING_DOWN,
                    assertThrows(DaemonException.class, () -> registry.heartbeat("s-1")).error());
            assertEquals(1, registry.list().size());
            assertEquals(1, store.load().size());
        }
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
