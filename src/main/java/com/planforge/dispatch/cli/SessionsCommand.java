package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.LivenessState;
import com.planforge.daemon.SessionRecord;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * CLI command: planforge sessions
 * <p>
 * Lists every session known to the running daemon with its liveness.
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List sessions known to the daemon")
@Component
public class SessionsCommand implements Runnable {

    @Option(names = {"--timeout"}, description = "RPC deadline in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int timeoutSecs;

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;

    public SessionsCommand(PlanforgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<SessionRecord> sessions;
        try (var client = DaemonClient.connect(properties.homePath(), Duration.ofSeconds(timeoutSecs), objectMapper)) {
            sessions = client.list();
        } catch (IOException e) {
            ConsoleOutput.error("Session daemon not reachable: " + e.getMessage());
            return;
        } catch (DaemonException e) {
            ConsoleOutput.error(e.error() + ": " + e.getMessage());
            return;
        }

        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions registered");
            return;
        }
        for (SessionRecord record : sessions) {
            ConsoleOutput.session(record);
        }
        ConsoleOutput.sessionSummary(
                ConsoleOutput.count(sessions, LivenessState.RUNNING),
                ConsoleOutput.count(sessions, LivenessState.UNRESPONSIVE),
                ConsoleOutput.count(sessions, LivenessState.STOPPED));
    }
}
