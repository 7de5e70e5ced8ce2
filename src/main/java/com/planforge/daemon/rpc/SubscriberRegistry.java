package com.planforge.daemon.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.metrics.PlanforgeMetrics;
import com.planforge.daemon.AuthToken;
import com.planforge.daemon.DaemonError;
import com.planforge.daemon.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves the subscriber port and pushes callbacks to every connected subscriber.
 * <p>
 * A subscriber connects, authenticates with the daemon token and then only answers calls:
 * {@code session_changed}, {@code daemon_restarting} and {@code ping}. A subscriber whose
 * delivery fails or times out is dropped. A periodic ping sweep drops the silent ones.
 */
public class SubscriberRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

    static final int CALLBACK_TIMEOUT_MS = 5_000;

    private final ServerSocket serverSocket;
    private final String token;
    private final ObjectMapper objectMapper;
    private final PlanforgeMetrics metrics;
    private final long pingIntervalSecs;

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong nextSubscriberId = new AtomicLong();
    private final AtomicLong nextCallId = new AtomicLong();

    private final ExecutorService acceptor = Executors.newSingleThreadExecutor(daemonThread("sessiond-subscriber-accept"));
    /** Delivers change notifications in order, off the RPC handler threads. */
    private final ExecutorService notifier = Executors.newSingleThreadExecutor(daemonThread("sessiond-notify"));
    private final ScheduledExecutorService pingScheduler =
            Executors.newSingleThreadScheduledExecutor(daemonThread("sessiond-subscriber-ping"));

    public SubscriberRegistry(ServerSocket serverSocket, String token, ObjectMapper objectMapper,
                              PlanforgeMetrics metrics, long pingIntervalSecs) {
        this.serverSocket = serverSocket;
        this.token = token;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.pingIntervalSecs = pingIntervalSecs;
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    public void start() {
        acceptor.execute(this::acceptLoop);
        pingScheduler.scheduleAtFixedRate(this::pingAll, pingIntervalSecs, pingIntervalSecs, TimeUnit.SECONDS);
        log.info("Subscriber port {} open (ping interval={}s)", port(), pingIntervalSecs);
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                handshake(socket);
            } catch (IOException e) {
                if (!serverSocket.isClosed()) {
                    log.warn("Subscriber accept failed: {}", e.getMessage());
                }
            }
        }
    }

    private void handshake(Socket socket) {
        JsonLineConnection connection = null;
        try {
            connection = new JsonLineConnection(socket, objectMapper,
                    RpcServer.ConnectionLimits.DEFAULT.maxRequestChars());
            connection.setReadTimeout(CALLBACK_TIMEOUT_MS);
            RpcRequest hello = connection.read(RpcRequest.class);
            if (hello == null || !"authenticate".equals(hello.method())
                    || !AuthToken.matches(token, hello.textParam("token"))) {
                long id = hello != null ? hello.id() : 0;
                connection.send(RpcResponse.failure(id, RpcError.of(DaemonError.AUTHENTICATION_FAILED.name(),
                        "subscriber authentication failed")));
                log.warn("Rejected unauthenticated subscriber from {}", connection.remoteAddress());
                connection.close();
                return;
            }
            connection.send(RpcResponse.success(hello.id(), objectMapper.getNodeFactory().booleanNode(true)));
            var subscriber = new Subscriber(nextSubscriberId.incrementAndGet(), connection);
            subscribers.add(subscriber);
            log.info("Subscriber {} connected from {}", subscriber.id, connection.remoteAddress());
        } catch (IOException e) {
            log.debug("Subscriber handshake failed: {}", e.getMessage());
            closeQuietly(connection);
        }
    }

    // -- Broadcasts ----------------------------------------------------------

    /**
     * Queues a {@code session_changed} callback to every subscriber.
     */
    public void broadcastSessionChanged(SessionRecord record) {
        if (subscribers.isEmpty() || notifier.isShutdown()) {
            return;
        }
        JsonNode params = objectMapper.createObjectNode().set("record", objectMapper.valueToTree(record));
        try {
            notifier.execute(() -> deliverToAll("session_changed", params));
        } catch (RejectedExecutionException e) {
            log.debug("Not notifying subscribers about {}: shutting down", record.sessionId());
        }
    }

    /**
     * Tells every subscriber that the daemon is going away. Blocks until each has answered
     * or timed out.
     */
    public void broadcastRestarting(String newSha) {
        JsonNode params = objectMapper.createObjectNode().put("new_sha", newSha);
        deliverToAll("daemon_restarting", params);
    }

    /**
     * Pings every subscriber and drops those that do not answer {@code true}.
     */
    public void pingAll() {
        if (subscribers.isEmpty()) {
            return;
        }
        log.debug("Pinging {} subscriber(s)", subscribers.size());
        List<Subscriber> failed = new ArrayList<>();
        for (Subscriber subscriber : subscribers) {
            JsonNode answer = subscriber.call("ping", null);
            if (answer == null || !answer.asBoolean(false)) {
                failed.add(subscriber);
            }
        }
        prune(failed);
    }

    public int count() {
        return subscribers.size();
    }

    private void deliverToAll(String method, JsonNode params) {
        List<Subscriber> failed = new ArrayList<>();
        for (Subscriber subscriber : subscribers) {
            if (subscriber.call(method, params) == null) {
                failed.add(subscriber);
            }
        }
        prune(failed);
    }

    private void prune(List<Subscriber> failed) {
        for (Subscriber subscriber : failed) {
            if (subscribers.remove(subscriber)) {
                closeQuietly(subscriber.connection);
                if (metrics != null) {
                    metrics.incrementSubscribersDropped();
                }
                log.warn("Dropped unresponsive subscriber {}", subscriber.id);
            }
        }
    }

    @Override
    public void close() {
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing subscriber port: {}", e.getMessage());
        }
        pingScheduler.shutdown();
        notifier.shutdown();
        try {
            if (!notifier.awaitTermination(5, TimeUnit.SECONDS)) {
                notifier.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifier.shutdownNow();
            Thread.currentThread().interrupt();
        }
        acceptor.shutdownNow();
        for (Subscriber subscriber : subscribers) {
            closeQuietly(subscriber.connection);
        }
        subscribers.clear();
        log.info("Subscriber port closed");
    }

    private static void closeQuietly(JsonLineConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Error closing subscriber connection: {}", e.getMessage());
        }
    }

    static ThreadFactory daemonThread(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private final class Subscriber {

        private final long id;
        private final JsonLineConnection connection;

        private Subscriber(long id, JsonLineConnection connection) {
            this.id = id;
            this.connection = connection;
        }

        /**
         * Calls the subscriber and waits for its answer. Returns {@code null} on any failure,
         * a JSON null when the call succeeded without a result.
         */
        synchronized JsonNode call(String method, JsonNode params) {
            long callId = nextCallId.incrementAndGet();
            try {
                connection.send(new RpcRequest(callId, method, params));
                RpcResponse response;
                do {
                    response = connection.read(RpcResponse.class);
                } while (response != null && response.id() != callId);
                if (response == null || response.isError()) {
                    return null;
                }
                return response.result() != null
                        ? response.result()
                        : objectMapper.getNodeFactory().nullNode();
            } catch (IOException e) {
                log.debug("Callback {} to subscriber {} failed: {}", method, id, e.getMessage());
                return null;
            }
        }
    }
}
