package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.time.Duration;

/**
 * CLI command: planforge upgrade
 * <p>
 * Asks the running daemon to retire in favour of this build. The daemon only agrees when
 * this build is strictly newer.
 */
@Command(name = "upgrade", mixinStandardHelpOptions = true,
        description = "Ask the running daemon to retire in favour of this build")
@Component
public class UpgradeCommand implements Runnable {

    @Option(names = {"--timestamp"}, description = "Build timestamp to present (default: this build's)")
    private Long timestamp;

    @Option(names = {"--timeout"}, description = "RPC deadline in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int timeoutSecs;

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;

    public UpgradeCommand(PlanforgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        long ours = timestamp != null ? timestamp : properties.getDaemon().getBuildTimestamp();
        try (var client = DaemonClient.connectUnauthenticated(properties.homePath(),
                Duration.ofSeconds(timeoutSecs), objectMapper)) {
            long theirs = client.buildTimestamp();
            if (client.requestUpgrade(ours)) {
                ConsoleOutput.success("Daemon built at " + theirs + " is retiring");
            } else {
                ConsoleOutput.info("Daemon built at " + theirs + " is not older than " + ours + "; it keeps running");
            }
        } catch (IOException e) {
            ConsoleOutput.error("Session daemon not reachable: " + e.getMessage());
        } catch (DaemonException e) {
            ConsoleOutput.error(e.error() + ": " + e.getMessage());
        }
    }
}
