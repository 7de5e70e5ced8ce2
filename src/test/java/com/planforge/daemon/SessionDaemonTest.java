package com.planforge.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.core.persistence.JsonSupport;
import com.planforge.daemon.files.FileAccessError;
import com.planforge.daemon.files.FileAccessException;
import com.planforge.daemon.rpc.DaemonClient;
import com.planforge.daemon.rpc.DaemonSubscriber;
import com.planforge.daemon.rpc.RpcServer;
import com.planforge.daemon.rpc.SubscriberCallback;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a real daemon on loopback ports and talks to it through the public clients.
 */
class SessionDaemonTest {

    private static final Duration DEADLINE = Duration.ofSeconds(5);
    private static final long BUILD_TIMESTAMP = 1_700_000_000L;

    @TempDir
    Path home;

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private SessionDaemon daemon;

    @BeforeEach
    void setUp() throws Exception {
        var settings = new PlanforgeProperties.Daemon();
        settings.setBuildSha("abc123");
        settings.setBuildTimestamp(BUILD_TIMESTAMP);
        settings.setSweepIntervalSecs(1);
        settings.setSubscriberPingSecs(1);
        settings.setAuthenticationTimeoutSecs(1);
        daemon = new SessionDaemon(home, settings, objectMapper, new PlanforgeMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC(), () -> LivenessThresholds.DEFAULT);
        daemon.start();
    }

    @AfterEach
    void tearDown() {
        daemon.stop();
    }

    private SessionRecord record(String id) {
        return SessionRecord.create(id, "audit", "/work", "/state/" + id, "Planning", 1, "Planning #1",
                ProcessHandle.current().pid(), Instant.now());
    }

    @Test
    @DisplayName("start publishes the discovery files")
    void discoveryFiles() throws Exception {
        PortFile portFile = PortFile.read(daemon.paths().portFile(), objectMapper);

        assertEquals(daemon.portFile(), portFile);
        assertEquals(AuthToken.LENGTH, portFile.token().length());
        assertEquals("abc123", Files.readString(daemon.paths().buildShaFile()));
        assertTrue(Files.exists(daemon.paths().pidFile()));
    }

    @Test
    @DisplayName("an authenticated client registers, heartbeats and lists sessions")
    void registerAndList() throws Exception {
        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            assertEquals("abc123", client.register(record("s-1")));
            client.heartbeat("s-1");

            var sessions = client.list();

            assertEquals(1, sessions.size());
            assertEquals("s-1", sessions.get(0).sessionId());
            assertEquals(LivenessState.RUNNING, sessions.get(0).liveness());
        }
    }

    @Test
    @DisplayName("an unauthenticated client only gets version information")
    void unauthenticated() throws Exception {
        try (DaemonClient client = DaemonClient.connectUnauthenticated(home, DEADLINE, objectMapper)) {
            assertEquals("abc123", client.buildSha());
            assertEquals(BUILD_TIMESTAMP, client.buildTimestamp());

            var ex = assertThrows(DaemonException.class, () -> client.register(record("s-1")));

            assertEquals(DaemonError.AUTHENTICATION_FAILED, ex.error());
        }
        assertEquals(0, daemon.registry().size());
    }

    @Test
    @DisplayName("a wrong token fails the connect")
    void wrongToken() throws Exception {
        int port = daemon.portFile().port();
        try (DaemonClient client = DaemonClient.open(port, DEADLINE, objectMapper)) {
            var ex = assertThrows(DaemonException.class, () -> client.authenticate("not-the-token"));
            assertEquals(DaemonError.AUTHENTICATION_FAILED, ex.error());
        }
    }

    @Test
    @DisplayName("a connection that never authenticates is closed")
    void silentConnectionClosed() throws Exception {
        try (var socket = new Socket(InetAddress.getLoopbackAddress(), daemon.portFile().port())) {
            socket.setSoTimeout(5_000);

            assertEquals(-1, socket.getInputStream().read());
        }
    }

    @Test
    @DisplayName("an oversized request is answered with an error and the connection closed")
    void oversizedRequest() throws Exception {
        int limit = RpcServer.ConnectionLimits.DEFAULT.maxRequestChars();
        try (var socket = new Socket(InetAddress.getLoopbackAddress(), daemon.portFile().port())) {
            socket.setSoTimeout(5_000);
            byte[] request = new byte[limit + 1];
            Arrays.fill(request, (byte) 'x');
            socket.getOutputStream().write(request);
            socket.getOutputStream().flush();

            var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            String reply = reader.readLine();

            assertNotNull(reply);
            assertTrue(reply.contains("INTERNAL"), reply);
            assertTrue(reply.contains("request too large"), reply);
            assertNull(reader.readLine());
        }
    }

    @Test
    @DisplayName("errors cross the wire with their details")
    void remoteErrors() throws Exception {
        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            var ex = assertThrows(DaemonException.class, () -> client.forceStop("ghost"));

            assertEquals(DaemonError.SESSION_NOT_FOUND, ex.error());
            assertEquals("ghost", ex.sessionId());
        }
    }

    @Test
    @DisplayName("session files are served over RPC")
    void sessionFiles() throws Exception {
        Path sessionDir = Files.createDirectories(daemon.paths().sessionDir("s-1"));
        Files.writeString(sessionDir.resolve("plan.md"), "# Plan");

        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            assertEquals("plan.md", client.listSessionFiles("s-1").get(0).name());
            assertEquals("# Plan", client.readSessionFile("s-1", "plan.md").content());

            var ex = assertThrows(FileAccessException.class,
                    () -> client.readSessionFile("s-1", "../../etc/passwd"));
            assertEquals(FileAccessError.PERMISSION_DENIED, ex.error());
        }
    }

    @Test
    @DisplayName("subscribers are told about every session change")
    void subscriberNotified() throws Exception {
        BlockingQueue<SessionRecord> changes = new LinkedBlockingQueue<>();
        SubscriberCallback callback = new SubscriberCallback() {
            @Override
            public void sessionChanged(SessionRecord record) {
                changes.add(record);
            }

            @Override
            public void daemonRestarting(String newSha) {
            }
        };

        try (DaemonSubscriber subscriber = DaemonSubscriber.connect(home, callback, DEADLINE, objectMapper);
             DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            waitFor(() -> daemon.subscribers().count() == 1);
            client.register(record("s-1"));

            SessionRecord seen = changes.poll(5, TimeUnit.SECONDS);

            assertNotNull(seen);
            assertEquals("s-1", seen.sessionId());
            assertTrue(subscriber.isConnected());
        }
    }

    @Test
    @DisplayName("an upgrade request from an equal build is refused and the daemon stays up")
    void upgradeRefused() throws Exception {
        try (DaemonClient client = DaemonClient.connectUnauthenticated(home, DEADLINE, objectMapper)) {
            assertFalse(client.requestUpgrade(BUILD_TIMESTAMP));
            assertFalse(client.requestUpgrade(BUILD_TIMESTAMP - 1));
        }

        assertFalse(daemon.isStopped());
        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            assertTrue(client.list().isEmpty());
        }
    }

    @Test
    @DisplayName("an upgrade request from a newer build stops the daemon and removes its files")
    void upgradeGranted() throws Exception {
        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            client.register(record("s-1"));
            assertTrue(client.requestUpgrade(BUILD_TIMESTAMP + 1));
        }

        assertTrue(daemon.awaitTermination(5, TimeUnit.SECONDS));
        assertFalse(Files.exists(daemon.paths().portFile()));
        assertFalse(Files.exists(daemon.paths().pidFile()));

        var store = new RegistryStore(daemon.paths().registryFile(), objectMapper);
        assertEquals("s-1", store.load().get(0).sessionId());
    }

    @Test
    @DisplayName("a restarted daemon remembers sessions as stopped")
    void restartKeepsRegistry() throws Exception {
        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            client.register(record("s-1"));
        }
        daemon.stop();

        var settings = new PlanforgeProperties.Daemon();
        daemon = new SessionDaemon(home, settings, objectMapper, new PlanforgeMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC(), () -> LivenessThresholds.DEFAULT);
        daemon.start();

        try (DaemonClient client = DaemonClient.connect(home, DEADLINE, objectMapper)) {
            var sessions = client.list();
            assertEquals(1, sessions.size());
            assertEquals(LivenessState.STOPPED, sessions.get(0).liveness());
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(condition.getAsBoolean());
    }
}
