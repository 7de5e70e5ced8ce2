package com.planforge.daemon;

import com.planforge.core.actor.ActorArgs;
import com.planforge.core.actor.WorkflowSupervisor;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.model.FeatureName;
import com.planforge.core.model.FeedbackPath;
import com.planforge.core.model.MaxIterations;
import com.planforge.core.model.Objective;
import com.planforge.core.model.PlanPath;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.model.WorkingDir;
import com.planforge.core.workflow.WorkflowCommand;
import com.planforge.daemon.rpc.DaemonClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class SessionTrackerTest {

    private static final Duration SLOW = Duration.ofHours(1);
    private static final Duration FAST = Duration.ofMillis(50);

    @TempDir
    Path tempDir;

    private DaemonClient client;
    private WorkflowSupervisor supervisor;
    private SessionTracker tracker;
    private String sessionId;

    @BeforeEach
    void setUp() {
        client = mock(DaemonClient.class);
        WorkflowId id = WorkflowId.newId();
        sessionId = id.toString();
        supervisor = WorkflowSupervisor.start(ActorArgs.inDirectory(id, tempDir),
                new PlanforgeMetrics(new SimpleMeterRegistry()));
        supervisor.execute(new WorkflowCommand.CreateWorkflow(FeatureName.of("search"), Objective.of("Full text"),
                WorkingDir.of("/repo"), MaxIterations.of(3), PlanPath.of("/p.md"), FeedbackPath.of("/f.md")));
    }

    @AfterEach
    void tearDown() {
        if (tracker != null) {
            tracker.close();
        }
        supervisor.stop();
    }

    @Test
    @DisplayName("track registers the session with its current phase")
    void trackRegisters() {
        tracker = new SessionTracker(() -> client, Clock.systemUTC(), SLOW);

        tracker.track(supervisor);

        var captor = ArgumentCaptor.forClass(SessionRecord.class);
        verify(client).register(captor.capture());
        SessionRecord record = captor.getValue();
        assertEquals(sessionId, record.sessionId());
        assertEquals("search", record.featureName());
        assertEquals("/repo", record.workingDir());
        assertEquals("Planning", record.phase());
        assertEquals(ProcessHandle.current().pid(), record.pid());
        assertEquals(tempDir.resolve("events.jsonl").toString(), record.statePath());
        assertEquals(List.of(sessionId), tracker.trackedSessions());
    }

    @Test
    @DisplayName("view changes are pushed as updates")
    void viewChangesPushed() {
        tracker = new SessionTracker(() -> client, Clock.systemUTC(), SLOW);
        tracker.track(supervisor);

        supervisor.execute(new WorkflowCommand.StartPlanning());
        supervisor.execute(new WorkflowCommand.PlanningCompleted(PlanPath.of("/p.md")));

        verify(client, timeout(2000)).update(argThat(r -> "Reviewing".equals(r.phase())));
    }

    @Test
    @DisplayName("untrack reports the session as stopped")
    void untrackStops() {
        tracker = new SessionTracker(() -> client, Clock.systemUTC(), SLOW);
        tracker.track(supervisor);

        tracker.untrack(sessionId);

        verify(client).update(argThat(r -> r.liveness() == LivenessState.STOPPED));
        assertTrue(tracker.trackedSessions().isEmpty());
    }

    @Test
    @DisplayName("heartbeats are sent on schedule")
    void heartbeats() {
        tracker = new SessionTracker(() -> client, Clock.systemUTC(), FAST);
        tracker.track(supervisor);

        verify(client, timeout(2000).atLeast(2)).heartbeat(sessionId);
    }

    @Test
    @DisplayName("an unreachable daemon is retried and the session registered once it appears")
    void reconnectsAndReregisters() {
        var daemonUp = new AtomicBoolean(false);
        tracker = new SessionTracker(() -> {
            if (!daemonUp.get()) {
                throw new ConnectException("connection refused");
            }
            return client;
        }, Clock.systemUTC(), FAST);

        assertDoesNotThrow(() -> tracker.track(supervisor));
        verifyNoInteractions(client);

        daemonUp.set(true);

        verify(client, timeout(2000)).register(argThat(r -> sessionId.equals(r.sessionId())));
        verify(client, timeout(2000).atLeastOnce()).heartbeat(sessionId);
    }

    @Test
    @DisplayName("a failed call drops the connection and a later tick reconnects")
    void failedCallReconnects() throws IOException {
        var connects = new AtomicInteger();
        doThrow(DaemonException.internal("deadline exceeded waiting for heartbeat", null))
                .doNothing()
                .when(client).heartbeat(sessionId);
        tracker = new SessionTracker(() -> {
            connects.incrementAndGet();
            return client;
        }, Clock.systemUTC(), FAST);

        tracker.track(supervisor);

        verify(client, timeout(2000)).close();
        verify(client, timeout(2000).times(2)).register(any());
        assertTrue(connects.get() >= 2);
    }

    @Test
    @DisplayName("ALREADY_REGISTERED keeps the connection")
    void alreadyRegisteredKeepsConnection() {
        when(client.register(any())).thenThrow(DaemonException.alreadyRegistered(sessionId, 99));
        var connects = new AtomicInteger();
        tracker = new SessionTracker(() -> {
            connects.incrementAndGet();
            return client;
        }, Clock.systemUTC(), SLOW);

        assertDoesNotThrow(() -> tracker.track(supervisor));

        verify(client, never()).close();
        assertEquals(1, connects.get());
    }
}
