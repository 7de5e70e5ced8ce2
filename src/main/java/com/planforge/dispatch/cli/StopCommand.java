package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.time.Duration;

/**
 * CLI command: planforge stop &lt;session-id&gt;
 * <p>
 * Marks a session as stopped in the daemon registry.
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Force-stop a session")
@Component
public class StopCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--timeout"}, description = "RPC deadline in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int timeoutSecs;

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;

    public StopCommand(PlanforgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try (var client = DaemonClient.connect(properties.homePath(), Duration.ofSeconds(timeoutSecs), objectMapper)) {
            client.forceStop(sessionId);
            ConsoleOutput.success("Session " + sessionId + " stopped");
        } catch (IOException e) {
            ConsoleOutput.error("Session daemon not reachable: " + e.getMessage());
        } catch (DaemonException e) {
            ConsoleOutput.error(e.error() + ": " + e.getMessage());
        }
    }
}
