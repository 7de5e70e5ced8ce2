package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.files.FileAccessException;
import com.planforge.daemon.files.FileEntry;
import com.planforge.daemon.rpc.DaemonClient;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.time.Duration;

/**
 * CLI command: planforge files &lt;session-id&gt; [filename]
 * <p>
 * Lists a session's files, or prints one of them, through the daemon.
 */
@Command(name = "files", mixinStandardHelpOptions = true, description = "List or read a session's files")
@Component
public class FilesCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", arity = "0..1", description = "File to print; omit to list the directory")
    private String filename;

    @Option(names = {"--timeout"}, description = "RPC deadline in seconds (default: ${DEFAULT-VALUE})",
            defaultValue = "5")
    private int timeoutSecs;

    private final PlanforgeProperties properties;
    private final ObjectMapper objectMapper;

    public FilesCommand(PlanforgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try (var client = DaemonClient.connect(properties.homePath(), Duration.ofSeconds(timeoutSecs), objectMapper)) {
            if (filename == null) {
                for (FileEntry entry : client.listSessionFiles(sessionId)) {
                    System.out.printf("  %-40s %10s  %s%n", entry.isDir() ? entry.name() + "/" : entry.name(),
                            entry.isDir() ? "-" : Long.toString(entry.size()), entry.modifiedAt());
                }
                return;
            }
            var result = client.readSessionFile(sessionId, filename);
            System.out.print(result.content());
            if (result.truncated()) {
                System.out.println();
                ConsoleOutput.info("Truncated: showing the first part of " + result.totalSize() + " bytes");
            }
        } catch (IOException e) {
            ConsoleOutput.error("Session daemon not reachable: " + e.getMessage());
        } catch (FileAccessException e) {
            ConsoleOutput.error(e.error() + ": " + e.getMessage());
        } catch (DaemonException e) {
            ConsoleOutput.error(e.error() + ": " + e.getMessage());
        }
    }
}
