package com.planforge.daemon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LivenessThresholdsTest {

    @Test
    @DisplayName("thresholds must be strictly exceeded")
    void classifyBoundaries() {
        var thresholds = LivenessThresholds.DEFAULT;

        assertEquals(LivenessState.RUNNING, thresholds.classify(Duration.ofSeconds(25)));
        assertEquals(LivenessState.UNRESPONSIVE, thresholds.classify(Duration.ofSeconds(26)));
        assertEquals(LivenessState.UNRESPONSIVE, thresholds.classify(Duration.ofSeconds(60)));
        assertEquals(LivenessState.STOPPED, thresholds.classify(Duration.ofSeconds(61)));
    }

    @Test
    @DisplayName("ages are compared in whole seconds")
    void wholeSeconds() {
        assertEquals(LivenessState.RUNNING,
                LivenessThresholds.DEFAULT.classify(Duration.ofSeconds(25).plusMillis(900)));
    }

    @Test
    @DisplayName("environment variables override the configured values")
    void environmentOverrides() {
        var env = Map.of(LivenessThresholds.UNRESPONSIVE_ENV, "3", LivenessThresholds.STALE_ENV, " 9 ");

        var thresholds = LivenessThresholds.fromEnvironment(env, LivenessThresholds.DEFAULT);

        assertEquals(LivenessThresholds.ofSeconds(3, 9), thresholds);
    }

    @Test
    @DisplayName("missing or unparseable overrides fall back to the defaults")
    void badOverrides() {
        var env = Map.of(LivenessThresholds.UNRESPONSIVE_ENV, "soon", LivenessThresholds.STALE_ENV, "");

        var thresholds = LivenessThresholds.fromEnvironment(env, LivenessThresholds.ofSeconds(10, 20));

        assertEquals(LivenessThresholds.ofSeconds(10, 20), thresholds);
        assertEquals(LivenessThresholds.DEFAULT,
                LivenessThresholds.fromEnvironment(Map.of(), LivenessThresholds.DEFAULT));
    }
}
