package com.planforge.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanforgeMetricsTest {

    private SimpleMeterRegistry registry;
    private PlanforgeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PlanforgeMetrics(registry);
    }

    @Test
    @DisplayName("recordCommand counts by command and result")
    void recordCommand() {
        metrics.recordCommand("StartPlanning", "accepted");
        metrics.recordCommand("StartPlanning", "accepted");
        metrics.recordCommand("StartPlanning", "invalid_transition");

        assertEquals(2.0, metrics.commandCount("StartPlanning", "accepted"));
        assertEquals(1.0, metrics.commandCount("StartPlanning", "invalid_transition"));
        assertEquals(0.0, metrics.commandCount("UserApproved", "accepted"));
    }

    @Test
    @DisplayName("recordAppend records duration and batch size")
    void recordAppend() {
        metrics.recordAppend(3, 12);

        var timer = registry.find("planforge.store.append.duration").timer();
        var summary = registry.find("planforge.events.appended").summary();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(summary);
        assertEquals(3.0, summary.totalAmount());
    }

    @Test
    @DisplayName("daemon counters are tagged")
    void daemonCounters() {
        metrics.recordRpcCall("list", true);
        metrics.recordRpcCall("list", false);
        metrics.recordLivenessTransition("UNRESPONSIVE");
        metrics.incrementSubscribersDropped();

        assertEquals(1.0, registry.find("planforge.daemon.rpc.calls")
                .tag("method", "list").tag("outcome", "error").counter().count());
        assertEquals(1.0, registry.find("planforge.daemon.liveness.transitions")
                .tag("liveness", "UNRESPONSIVE").counter().count());
        assertEquals(1.0, registry.find("planforge.daemon.subscribers.dropped").counter().count());
    }

    @Test
    @DisplayName("actor restarts are tagged with the reason")
    void actorRestarts() {
        metrics.incrementActorRestarts("IllegalStateException");

        assertNotNull(registry.find("planforge.actor.restarts").tag("reason", "IllegalStateException").counter());
    }
}
