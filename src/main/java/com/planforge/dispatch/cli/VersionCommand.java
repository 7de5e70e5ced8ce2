package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.time.Duration;

/**
 * CLI command: planforge version
 * <p>
 * Prints this build and, when one is running, the daemon's build.
 */
@Command(name = "version", mixinStandardHelpOptions = true, description = "Show build versions")
@Component
public class VersionCommand implements Runnable {

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;

    public VersionCommand(PlanforgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        var daemon = properties.getDaemon();
        ConsoleOutput.info("CLI build " + daemon.getBuildSha() + " (" + daemon.getBuildTimestamp() + ")");
        try (var client = DaemonClient.connectUnauthenticated(properties.homePath(), Duration.ofSeconds(2),
                objectMapper)) {
            ConsoleOutput.info("Daemon build " + client.buildSha() + " (" + client.buildTimestamp() + ")");
        } catch (IOException | DaemonException e) {
            ConsoleOutput.info("No session daemon running");
        }
    }
}
