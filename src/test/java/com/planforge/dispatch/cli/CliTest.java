package com.planforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.engine.WorkflowEngine;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.persistence.JsonSupport;
import com.planforge.core.policy.FailurePolicy;
import com.planforge.daemon.LivenessState;
import com.planforge.daemon.SessionDaemon;
import com.planforge.daemon.SessionRecord;
import com.planforge.daemon.rpc.DaemonClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PlanForge CLI command structure.
 * Commands are built by hand and run through picocli without a Spring context.
 */
class CliTest {

    @TempDir
    Path home;

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private PlanforgeProperties properties;
    private PlanforgeMetrics metrics;
    private WorkflowEngine engine;
    private SessionDaemon daemon;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() {
        properties = new PlanforgeProperties();
        properties.setHome(home.toString());
        properties.getDaemon().setBuildSha("abc123");
        properties.getDaemon().setBuildTimestamp(1_700_000_000L);
        metrics = new PlanforgeMetrics(new SimpleMeterRegistry());
        engine = new WorkflowEngine(properties, metrics, FailurePolicy.DEFAULT, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (daemon != null) {
            daemon.stop();
        }
        engine.stopAll();
    }

    private void startDaemon() throws Exception {
        daemon = new SessionDaemon(home, properties.getDaemon(), objectMapper, metrics, Clock.systemUTC());
        daemon.start();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SessionsCommand.class) {
                    return (K) new SessionsCommand(properties, objectMapper);
                }
                if (cls == StopCommand.class) {
                    return (K) new StopCommand(properties, objectMapper);
                }
                if (cls == FilesCommand.class) {
                    return (K) new FilesCommand(properties, objectMapper);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(engine);
                }
                if (cls == CreateCommand.class) {
                    return (K) new CreateCommand(engine, properties, objectMapper, Clock.systemUTC());
                }
                if (cls == UpgradeCommand.class) {
                    return (K) new UpgradeCommand(properties, objectMapper);
                }
                if (cls == VersionCommand.class) {
                    return (K) new VersionCommand(properties, objectMapper);
                }
                if (cls == DaemonCommand.class) {
                    return (K) new DaemonCommand(properties, objectMapper, metrics, Clock.systemUTC());
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new PlanforgeCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private void register(String sessionId) throws Exception {
        try (var client = DaemonClient.connect(home, Duration.ofSeconds(5), objectMapper)) {
            client.register(SessionRecord.create(sessionId, "audit", "/work", "/state", "Reviewing", 2,
                    "Reviewing #2", ProcessHandle.current().pid(), Instant.now()));
        }
    }

    // -- Help ------------------------------------------------------------------

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("daemon", "sessions", "stop", "files", "status", "create", "upgrade",
                    "version", "help")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PlanForge 0.1.0"));
        }

        @Test
        @DisplayName("stop without a session id is a usage error")
        void stopNeedsId() {
            CliResult result = execute("stop");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("Missing required parameter"));
        }
    }

    // -- Without a daemon ------------------------------------------------------

    @Nested
    @DisplayName("Without a daemon")
    class NoDaemonTests {

        @Test
        @DisplayName("sessions reports an unreachable daemon")
        void sessionsUnreachable() {
            CliResult result = execute("sessions");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Session daemon not reachable"));
        }

        @Test
        @DisplayName("version prints the CLI build only")
        void versionWithoutDaemon() {
            CliResult result = execute("version");

            assertTrue(result.output().contains("CLI build abc123 (1700000000)"));
            assertTrue(result.output().contains("No session daemon running"));
        }
    }

    // -- With a daemon ---------------------------------------------------------

    @Nested
    @DisplayName("With a daemon")
    class DaemonTests {

        @BeforeEach
        void start() throws Exception {
            startDaemon();
        }

        @Test
        @DisplayName("sessions lists registered sessions with a liveness summary")
        void sessionsListed() throws Exception {
            register("s-1");

            CliResult result = execute("sessions");

            assertTrue(result.output().contains("s-1"));
            assertTrue(result.output().contains("Reviewing #2"));
            assertTrue(result.output().contains("1 running"));
        }

        @Test
        @DisplayName("stop marks the session stopped")
        void stopSession() throws Exception {
            register("s-1");

            CliResult result = execute("stop", "s-1");

            assertTrue(result.output().contains("Session s-1 stopped"));
            assertEquals(LivenessState.STOPPED, daemon.registry().get("s-1").orElseThrow().liveness());
        }

        @Test
        @DisplayName("stop of an unknown session shows the error kind")
        void stopUnknown() {
            CliResult result = execute("stop", "ghost");

            assertTrue(result.output().contains("SESSION_NOT_FOUND"));
        }

        @Test
        @DisplayName("files lists and prints session files")
        void files() throws Exception {
            Path dir = Files.createDirectories(home.resolve("sessions").resolve("s-1"));
            Files.writeString(dir.resolve("plan.md"), "# The plan");

            assertTrue(execute("files", "s-1").output().contains("plan.md"));
            assertTrue(execute("files", "s-1", "plan.md").output().contains("# The plan"));
            assertTrue(execute("files", "s-1", "../secret").output().contains("PERMISSION_DENIED"));
        }

        @Test
        @DisplayName("upgrade with an equal build leaves the daemon running")
        void upgradeRefused() {
            CliResult result = execute("upgrade");

            assertTrue(result.output().contains("keeps running"));
            assertFalse(daemon.isStopped());
        }

        @Test
        @DisplayName("upgrade with a newer build retires the daemon")
        void upgradeGranted() throws Exception {
            CliResult result = execute("upgrade", "--timestamp", "1700000001");

            assertTrue(result.output().contains("is retiring"));
            assertTrue(daemon.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    // -- Workflows -------------------------------------------------------------

    @Nested
    @DisplayName("Workflows")
    class WorkflowTests {

        @Test
        @DisplayName("create starts planning and status shows the workflow")
        void createThenStatus() throws Exception {
            CliResult created = execute("create", "audit", "-o", "Audit log", "-d", home.toString());

            assertEquals(0, created.exitCode());
            assertTrue(created.output().contains("created"));

            String id;
            try (var dirs = Files.list(home.resolve("state"))) {
                id = dirs.findFirst().orElseThrow().getFileName().toString();
            }
            CliResult status = execute("status", id);

            assertTrue(status.output().contains("Feature:    audit"));
            assertTrue(status.output().contains("Objective:  Audit log"));
            assertTrue(status.output().contains("Events:     2"));
        }

        @Test
        @DisplayName("create rejects a zero iteration budget")
        void createRejectsZeroIterations() {
            CliResult result = execute("create", "audit", "-o", "Audit log", "--max-iterations", "0");

            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("status rejects malformed and unknown ids")
        void statusErrors() {
            assertTrue(execute("status", "not-a-uuid").output().contains("Not a workflow ID"));
            assertTrue(execute("status", "6f1c2a9e-0000-4000-8000-000000000001").output()
                    .contains("Workflow not found"));
        }
    }
}
