package com.planforge.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Heartbeat ages after which a session counts as unresponsive or stopped.
 */
public record LivenessThresholds(Duration unresponsive, Duration stale) {

    private static final Logger log = LoggerFactory.getLogger(LivenessThresholds.class);

    public static final String UNRESPONSIVE_ENV = "PLANFORGE_SESSIOND_UNRESPONSIVE_SECS";
    public static final String STALE_ENV = "PLANFORGE_SESSIOND_STALE_SECS";

    public static final LivenessThresholds DEFAULT = ofSeconds(25, 60);

    public static LivenessThresholds ofSeconds(long unresponsiveSecs, long staleSecs) {
        return new LivenessThresholds(Duration.ofSeconds(unresponsiveSecs), Duration.ofSeconds(staleSecs));
    }

    /**
     * Applies the environment overrides on top of {@code defaults}. Unparseable values are
     * ignored.
     */
    public static LivenessThresholds fromEnvironment(Map<String, String> env, LivenessThresholds defaults) {
        long unresponsive = parseSeconds(env.get(UNRESPONSIVE_ENV), UNRESPONSIVE_ENV,
                defaults.unresponsive().toSeconds());
        long stale = parseSeconds(env.get(STALE_ENV), STALE_ENV, defaults.stale().toSeconds());
        return ofSeconds(unresponsive, stale);
    }

    private static long parseSeconds(String raw, String name, long fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number of seconds", name, raw);
            return fallback;
        }
    }

    /**
     * Classifies a heartbeat of age {@code elapsed}. Ages are compared in whole seconds and
     * must strictly exceed a threshold.
     */
    public LivenessState classify(Duration elapsed) {
        long secs = elapsed.getSeconds();
        if (secs > stale.getSeconds()) {
            return LivenessState.STOPPED;
        }
        if (secs > unresponsive.getSeconds()) {
            return LivenessState.UNRESPONSIVE;
        }
        return LivenessState.RUNNING;
    }
}
