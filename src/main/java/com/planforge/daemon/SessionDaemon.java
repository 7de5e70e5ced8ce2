package com.planforge.daemon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.config.PlanforgeProperties;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.daemon.files.SessionFileService;
import com.planforge.daemon.rpc.RpcServer;
import com.planforge.daemon.rpc.SubscriberRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * The session daemon process: registry, RPC endpoint, subscriber endpoint, liveness sweep
 * and the discovery files under {@code <home>/daemon/}.
 * <p>
 * {@link #start()} binds both ports on the configured loopback address and publishes the port
 * file last, so a client that finds the file can connect. {@link #stop()} is idempotent and
 * also runs when a client calls {@code shutdown} or wins an upgrade negotiation.
 */
public class SessionDaemon implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionDaemon.class);

    private final DaemonPaths paths;
    private final PlanforgeProperties.Daemon settings;
    private final BuildInfo build;
    private final ObjectMapper objectMapper;
    private final PlanforgeMetrics metrics;
    private final Clock clock;
    private final Supplier<LivenessThresholds> thresholds;

    private final CountDownLatch terminated = new CountDownLatch(1);
    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sessiond-liveness");
        t.setDaemon(true);
        return t;
    });

    private SessionRegistry registry;
    private SubscriberRegistry subscribers;
    private RpcServer rpcServer;
    private String token;
    private volatile boolean started;
    private volatile boolean stopped;

    public SessionDaemon(Path home, PlanforgeProperties.Daemon settings, ObjectMapper objectMapper,
                         PlanforgeMetrics metrics, Clock clock) {
        this(home, settings, objectMapper, metrics, clock, () -> LivenessThresholds.fromEnvironment(System.getenv(),
                LivenessThresholds.ofSeconds(settings.getUnresponsiveSecs(), settings.getStaleSecs())));
    }

    SessionDaemon(Path home, PlanforgeProperties.Daemon settings, ObjectMapper objectMapper,
                  PlanforgeMetrics metrics, Clock clock, Supplier<LivenessThresholds> thresholds) {
        this.paths = new DaemonPaths(home);
        this.settings = settings;
        this.build = new BuildInfo(settings.getBuildSha(), settings.getBuildTimestamp());
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.thresholds = thresholds;
    }

    /**
     * Loads the registry, opens both ports and writes the discovery files.
     *
     * @throws IOException if a port cannot be bound or a file cannot be written
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("daemon already started");
        }
        started = true;
        Files.createDirectories(paths.daemonDir());
        registry = SessionRegistry.load(new RegistryStore(paths.registryFile(), objectMapper), clock, thresholds,
                metrics);
        token = AuthToken.generate();

        InetAddress address = InetAddress.getByName(settings.getBindAddress());
        subscribers = new SubscriberRegistry(new ServerSocket(0, 50, address), token, objectMapper, metrics,
                settings.getSubscriberPingSecs());
        rpcServer = new RpcServer(new ServerSocket(0, 50, address), registry, subscribers,
                new SessionFileService(paths.sessionsDir()), build, token, objectMapper, metrics,
                this::stopAsync, new RpcServer.ConnectionLimits(
                        Duration.ofSeconds(settings.getAuthenticationTimeoutSecs()),
                        Duration.ofSeconds(settings.getIdleTimeoutSecs()),
                        RpcServer.ConnectionLimits.DEFAULT.maxRequestChars()));
        registry.onChange(subscribers::broadcastSessionChanged);

        subscribers.start();
        rpcServer.start();
        long interval = settings.getSweepIntervalSecs();
        sweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.SECONDS);

        Files.writeString(paths.pidFile(), Long.toString(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        Files.writeString(paths.buildShaFile(), build.sha(), StandardCharsets.UTF_8);
        portFile().write(paths.portFile(), objectMapper);
        log.info("Session daemon {} started (rpc port {}, subscriber port {}, {} known session(s))",
                build.sha(), rpcServer.port(), subscribers.port(), registry.size());
    }

    private void sweepSafely() {
        try {
            registry.sweep();
        } catch (RuntimeException e) {
            log.warn("Liveness sweep failed: {}", e.getMessage(), e);
        }
    }

    private void stopAsync() {
        Thread t = new Thread(this::stop, "sessiond-shutdown");
        t.setDaemon(true);
        t.start();
    }

    /**
     * Persists the registry, closes both ports and removes the discovery files.
     */
    public synchronized void stop() {
        if (stopped || !started) {
            return;
        }
        stopped = true;
        sweeper.shutdownNow();
        try {
            registry.beginShutdown();
        } catch (DaemonException e) {
            log.warn("Could not persist session registry on shutdown: {}", e.getMessage(), e);
        }
        rpcServer.close();
        subscribers.close();
        removeDiscoveryFiles();
        terminated.countDown();
        log.info("Session daemon stopped");
    }

    private void removeDiscoveryFiles() {
        try {
            Path portPath = paths.portFile();
            if (Files.exists(portPath) && token.equals(PortFile.read(portPath, objectMapper).token())) {
                Files.delete(portPath);
            }
            Files.deleteIfExists(paths.pidFile());
            Files.deleteIfExists(paths.buildShaFile());
        } catch (IOException e) {
            log.warn("Could not remove daemon discovery files: {}", e.getMessage());
        }
    }

    /**
     * Blocks until the daemon has stopped.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public PortFile portFile() {
        return new PortFile(rpcServer.port(), subscribers.port(), token);
    }

    public DaemonPaths paths() {
        return paths;
    }

    public BuildInfo build() {
        return build;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public SubscriberRegistry subscribers() {
        return subscribers;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public void close() {
        stop();
    }
}
