package com.planforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution and the session daemon.
 */
@Service
public class PlanforgeMetrics {

    private final MeterRegistry registry;

    public PlanforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCommand(String command, String result) {
        Counter.builder("planforge.commands.total")
                .tag("command", command)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordAppend(int eventCount, long ms) {
        Timer.builder("planforge.store.append.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("planforge.events.appended")
                .register(registry)
                .record(eventCount);
    }

    public void incrementActorRestarts(String reason) {
        Counter.builder("planforge.actor.restarts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    // --- Session daemon ---

    public void recordRpcCall(String method, boolean success) {
        Counter.builder("planforge.daemon.rpc.calls")
                .tag("method", method)
                .tag("outcome", success ? "ok" : "error")
                .register(registry)
                .increment();
    }

    /**
     * Records a liveness transition made by the sweep.
     *
     * @param liveness the state a session moved into
     */
    public void recordLivenessTransition(String liveness) {
        Counter.builder("planforge.daemon.liveness.transitions")
                .tag("liveness", liveness)
                .register(registry)
                .increment();
    }

    public void incrementSubscribersDropped() {
        Counter.builder("planforge.daemon.subscribers.dropped")
                .register(registry)
                .increment();
    }

    public double commandCount(String command, String result) {
        Counter counter = registry.find("planforge.commands.total")
                .tag("command", command)
                .tag("result", result)
                .counter();
        return counter != null ? counter.count() : 0.0;
    }
}
