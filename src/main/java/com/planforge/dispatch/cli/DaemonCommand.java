package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.SessionDaemon;
import com.planforge.daemon.rpc.DaemonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: planforge daemon
 * <p>
 * Runs the session daemon in the foreground until it is shut down over RPC, retired by a
 * newer build, or the JVM is interrupted. An already running daemon is asked to retire first;
 * if it is at least as new as this build it stays and this command exits with 1.
 */
@Command(name = "daemon", mixinStandardHelpOptions = true, description = "Run the session daemon")
@Component
public class DaemonCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DaemonCommand.class);

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;
    private final PlanforgeMetrics metrics;
    private final Clock clock;

    public DaemonCommand(PlanforgeProperties properties, ObjectMapper objectMapper, PlanforgeMetrics metrics,
                         Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Integer call() throws Exception {
        ConsoleOutput.printBanner();
        if (!retireRunningDaemon()) {
            ConsoleOutput.error("A session daemon of the same or a newer build is already running");
            return 1;
        }

        var daemon = new SessionDaemon(properties.homePath(), properties.getDaemon(), objectMapper, metrics, clock);
        daemon.start();
        Thread hook = new Thread(daemon::stop, "sessiond-jvm-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        var portFile = daemon.portFile();
        ConsoleOutput.success("Session daemon " + daemon.build().sha() + " listening on port " + portFile.port()
                + " (subscribers on " + portFile.subscriberPort() + ")");
        ConsoleOutput.info("Press Ctrl+C to stop.");

        daemon.awaitTermination();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
        ConsoleOutput.info("Session daemon stopped");
        return 0;
    }

    /**
     * @return true when no daemon is running any more
     */
    private boolean retireRunningDaemon() throws InterruptedException {
        var home = properties.homePath();
        try (DaemonClient client = DaemonClient.connectUnauthenticated(home, Duration.ofSeconds(2), objectMapper)) {
            long ours = properties.getDaemon().getBuildTimestamp();
            if (!client.requestUpgrade(ours)) {
                return false;
            }
        } catch (IOException | DaemonException e) {
            log.debug("No running daemon found: {}", e.getMessage());
            return true;
        }
        ConsoleOutput.info("Retired the older session daemon");
        // give it time to release its files
        TimeUnit.MILLISECONDS.sleep(500);
        return true;
    }
}
