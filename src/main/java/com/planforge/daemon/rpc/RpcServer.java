package com.planforge.daemon.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.planforge.core.logging.MdcContext;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.daemon.AuthToken;
import com.planforge.daemon.BuildInfo;
import com.planforge.daemon.DaemonError;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.SessionRecord;
import com.planforge.daemon.SessionRegistry;
import com.planforge.daemon.files.FileAccessException;
import com.planforge.daemon.files.SessionFileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The daemon's main RPC endpoint.
 * <p>
 * One thread accepts connections and every connection gets its own handler thread, which
 * answers requests in the order they arrive. A connection starts unauthenticated; only
 * {@code build_sha}, {@code build_timestamp} and {@code request_upgrade} work before a
 * successful {@code authenticate}.
 */
public class RpcServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    static final Set<String> PUBLIC_METHODS =
            Set.of("authenticate", "build_sha", "build_timestamp", "request_upgrade");

    /**
     * Bounds on what one client connection may hold on to.
     *
     * @param authenticationTimeout how long a connection may stay silent before authenticating
     * @param idleTimeout           how long an authenticated connection may stay silent
     * @param maxRequestChars       longest request line accepted
     */
    public record ConnectionLimits(Duration authenticationTimeout, Duration idleTimeout, int maxRequestChars) {

        public static final ConnectionLimits DEFAULT =
                new ConnectionLimits(Duration.ofSeconds(10), Duration.ofMinutes(5), 1024 * 1024);
    }

    private final ServerSocket serverSocket;
    private final SessionRegistry registry;
    private final SubscriberRegistry subscribers;
    private final SessionFileService files;
    private final BuildInfo build;
    private final String token;
    private final ObjectMapper objectMapper;
    private final PlanforgeMetrics metrics;
    private final Runnable shutdownHook;
    private final ConnectionLimits limits;

    private final Set<JsonLineConnection> openConnections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionCounter = new AtomicInteger();
    private final ExecutorService acceptor =
            Executors.newSingleThreadExecutor(SubscriberRegistry.daemonThread("sessiond-rpc-accept"));
    private final ExecutorService handlers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sessiond-rpc-" + connectionCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * @param shutdownHook stops the daemon; called after the reply to {@code shutdown} or a
     *                     granted {@code request_upgrade} has been sent
     */
    public RpcServer(ServerSocket serverSocket, SessionRegistry registry, SubscriberRegistry subscribers,
                     SessionFileService files, BuildInfo build, String token, ObjectMapper objectMapper,
                     PlanforgeMetrics metrics, Runnable shutdownHook) {
        this(serverSocket, registry, subscribers, files, build, token, objectMapper, metrics, shutdownHook,
                ConnectionLimits.DEFAULT);
    }

    public RpcServer(ServerSocket serverSocket, SessionRegistry registry, SubscriberRegistry subscribers,
                     SessionFileService files, BuildInfo build, String token, ObjectMapper objectMapper,
                     PlanforgeMetrics metrics, Runnable shutdownHook, ConnectionLimits limits) {
        this.serverSocket = serverSocket;
        this.limits = limits;
        this.registry = registry;
        this.subscribers = subscribers;
        this.files = files;
        this.build = build;
        this.token = token;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.shutdownHook = shutdownHook;
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public void start() {
        acceptor.execute(this::acceptLoop);
        log.info("RPC server listening on {}:{}", serverSocket.getInetAddress().getHostAddress(), port());
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                handlers.execute(() -> serve(socket));
            } catch (IOException e) {
                if (!serverSocket.isClosed()) {
                    log.warn("RPC accept failed: {}", e.getMessage());
                }
            }
        }
    }

    private void serve(Socket socket) {
        var state = new ConnectionState();
        try (var connection = new JsonLineConnection(socket, objectMapper, limits.maxRequestChars())) {
            openConnections.add(connection);
            String remote = connection.remoteAddress();
            log.debug("RPC connection from {}", remote);
            connection.setReadTimeout(timeoutMillis(limits.authenticationTimeout()));
            String line;
            while ((line = readRequest(connection, remote)) != null) {
                boolean wasAuthenticated = state.authenticated;
                RpcResponse response = handleLine(line, state, remote);
                connection.send(response);
                if (state.stopAfterReply) {
                    shutdownHook.run();
                    return;
                }
                if (state.authenticated && !wasAuthenticated) {
                    connection.setReadTimeout(timeoutMillis(limits.idleTimeout()));
                }
            }
            log.debug("RPC connection from {} closed", remote);
        } catch (IOException e) {
            log.debug("RPC connection ended: {}", e.getMessage());
        } finally {
            openConnections.removeIf(JsonLineConnection::isClosed);
        }
    }

    /**
     * Next request line, or null when the connection should be closed.
     */
    private String readRequest(JsonLineConnection connection, String remote) throws IOException {
        try {
            return connection.readLine();
        } catch (SocketTimeoutException e) {
            log.debug("Closing silent RPC connection from {}", remote);
            return null;
        } catch (JsonLineConnection.LineTooLongException e) {
            log.warn("Closing RPC connection from {}: {}", remote, e.getMessage());
            connection.send(RpcResponse.failure(0, RpcError.of(DaemonError.INTERNAL.name(),
                    "request too large: " + e.getMessage())));
            return null;
        }
    }

    private static int timeoutMillis(Duration timeout) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
    }

    RpcResponse handleLine(String line, ConnectionState state, String remote) {
        RpcRequest request;
        try {
            request = objectMapper.readValue(line, RpcRequest.class);
        } catch (JsonProcessingException e) {
            return RpcResponse.failure(0, RpcError.of(DaemonError.INTERNAL.name(),
                    "invalid request: " + e.getOriginalMessage()));
        }
        MdcContext.setRpc(request.method(), remote);
        try {
            JsonNode result = dispatch(request, state);
            record(request.method(), true);
            return RpcResponse.success(request.id(), result);
        } catch (DaemonException e) {
            record(request.method(), false);
            log.debug("RPC {} failed: {}", request.method(), e.getMessage());
            return RpcResponse.failure(request.id(),
                    new RpcError(e.error().name(), e.getMessage(), e.sessionId(), e.existingPid()));
        } catch (FileAccessException e) {
            record(request.method(), false);
            log.debug("RPC {} failed: {}", request.method(), e.getMessage());
            return RpcResponse.failure(request.id(), RpcError.of(e.error().name(), e.getMessage()));
        } catch (RuntimeException e) {
            record(request.method(), false);
            log.error("RPC {} failed unexpectedly", request.method(), e);
            return RpcResponse.failure(request.id(),
                    RpcError.of(DaemonError.INTERNAL.name(), String.valueOf(e.getMessage())));
        } finally {
            MdcContext.clear();
        }
    }

    private JsonNode dispatch(RpcRequest request, ConnectionState state) {
        String method = request.method() != null ? request.method() : "";
        if (!PUBLIC_METHODS.contains(method) && !state.authenticated) {
            throw DaemonException.authenticationFailed();
        }
        JsonNodeFactory nodes = objectMapper.getNodeFactory();
        return switch (method) {
            case "authenticate" -> {
                if (!AuthToken.matches(token, request.textParam("token"))) {
                    log.warn("Client authentication failed");
                    throw DaemonException.authenticationFailed();
                }
                state.authenticated = true;
                yield nodes.nullNode();
            }
            case "register" -> {
                registry.register(recordParam(request));
                yield nodes.textNode(build.sha());
            }
            case "update" -> {
                registry.update(recordParam(request));
                yield nodes.textNode(build.sha());
            }
            case "heartbeat" -> {
                registry.heartbeat(requiredText(request, "session_id"));
                yield nodes.nullNode();
            }
            case "list" -> objectMapper.valueToTree(registry.list());
            case "force_stop" -> {
                registry.forceStop(requiredText(request, "session_id"));
                yield nodes.nullNode();
            }
            case "shutdown" -> {
                log.info("Shutdown requested");
                retire();
                state.stopAfterReply = true;
                yield nodes.nullNode();
            }
            case "build_sha" -> nodes.textNode(build.sha());
            case "build_timestamp" -> nodes.numberNode(build.timestamp());
            case "request_upgrade" -> {
                long callerTimestamp = request.param("timestamp") != null ? request.param("timestamp").asLong() : 0;
                if (build.isSupersededBy(callerTimestamp)) {
                    log.info("Upgrade requested: caller={} > daemon={}, shutting down",
                            callerTimestamp, build.timestamp());
                    retire();
                    state.stopAfterReply = true;
                    yield nodes.booleanNode(true);
                }
                log.info("Upgrade refused: caller={} <= daemon={} (or daemon timestamp unknown)",
                        callerTimestamp, build.timestamp());
                yield nodes.booleanNode(false);
            }
            case "list_session_files" -> objectMapper.valueToTree(
                    files.listSessionFiles(requiredText(request, "session_id")));
            case "read_session_file" -> objectMapper.valueToTree(
                    files.readSessionFile(requiredText(request, "session_id"), requiredText(request, "filename")));
            default -> throw DaemonException.internal("unknown method: " + method, null);
        };
    }

    /** Warns subscribers and persists the registry; the hook stops the daemon after the reply. */
    private void retire() {
        subscribers.broadcastRestarting(build.sha());
        registry.beginShutdown();
    }

    private SessionRecord recordParam(RpcRequest request) {
        JsonNode node = request.param("record");
        if (node == null || node.isNull()) {
            throw DaemonException.internal("missing parameter: record", null);
        }
        try {
            return objectMapper.treeToValue(node, SessionRecord.class);
        } catch (JsonProcessingException e) {
            throw DaemonException.internal("invalid session record: " + e.getOriginalMessage(), e);
        }
    }

    private static String requiredText(RpcRequest request, String name) {
        String value = request.textParam(name);
        if (value == null) {
            throw DaemonException.internal("missing parameter: " + name, null);
        }
        return value;
    }

    private void record(String method, boolean success) {
        if (metrics != null) {
            metrics.recordRpcCall(method, success);
        }
    }

    @Override
    public void close() {
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing RPC socket: {}", e.getMessage());
        }
        for (JsonLineConnection connection : openConnections) {
            try {
                connection.close();
            } catch (IOException e) {
                log.debug("Error closing RPC connection: {}", e.getMessage());
            }
        }
        openConnections.clear();
        acceptor.shutdownNow();
        handlers.shutdownNow();
        log.info("RPC server stopped");
    }

    /** Per-connection state. */
    static final class ConnectionState {
        boolean authenticated;
        boolean stopAfterReply;
    }
}
