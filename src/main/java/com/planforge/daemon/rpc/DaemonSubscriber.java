package com.planforge.daemon.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.daemon.DaemonError;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.DaemonPaths;
import com.planforge.daemon.PortFile;
import com.planforge.daemon.SessionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Client side of the subscriber port: authenticates, then serves the daemon's callbacks
 * on a background thread until either side closes the connection.
 */
public class DaemonSubscriber implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DaemonSubscriber.class);

    private final JsonLineConnection connection;
    private final SubscriberCallback callback;
    private final ObjectMapper objectMapper;
    private final Thread reader;

    private DaemonSubscriber(JsonLineConnection connection, SubscriberCallback callback, ObjectMapper objectMapper) {
        this.connection = connection;
        this.callback = callback;
        this.objectMapper = objectMapper;
        this.reader = new Thread(this::serve, "planforge-subscriber");
        this.reader.setDaemon(true);
    }

    /**
     * Connects to the daemon found through the port file under {@code home}.
     *
     * @param timeout connect and handshake timeout
     * @throws IOException     if the daemon cannot be reached
     * @throws DaemonException {@code AUTHENTICATION_FAILED} if the token is refused
     */
    public static DaemonSubscriber connect(Path home, SubscriberCallback callback, Duration timeout,
                                           ObjectMapper objectMapper) throws IOException {
        PortFile portFile = PortFile.read(new DaemonPaths(home).portFile(), objectMapper);
        int timeoutMs = (int) Math.max(1, timeout.toMillis());
        var socket = new Socket();
        JsonLineConnection connection;
        try {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), portFile.subscriberPort()),
                    timeoutMs);
            socket.setSoTimeout(timeoutMs);
            connection = new JsonLineConnection(socket, objectMapper);
            connection.send(new RpcRequest(1, "authenticate",
                    objectMapper.createObjectNode().put("token", portFile.token())));
            RpcResponse response = connection.read(RpcResponse.class);
            if (response == null || response.isError()) {
                throw new DaemonException(DaemonError.AUTHENTICATION_FAILED,
                        response != null ? response.error().message() : "daemon closed the subscriber connection");
            }
            // callbacks arrive at the daemon's pace
            connection.setReadTimeout(0);
        } catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
        var subscriber = new DaemonSubscriber(connection, callback, objectMapper);
        subscriber.reader.start();
        log.debug("Subscribed to daemon on port {}", portFile.subscriberPort());
        return subscriber;
    }

    private void serve() {
        try {
            RpcRequest request;
            while ((request = connection.read(RpcRequest.class)) != null) {
                RpcResponse response;
                try {
                    response = RpcResponse.success(request.id(), handle(request));
                } catch (RuntimeException e) {
                    log.warn("Subscriber callback {} failed: {}", request.method(), e.getMessage(), e);
                    response = RpcResponse.failure(request.id(),
                            RpcError.of(DaemonError.INTERNAL.name(), String.valueOf(e.getMessage())));
                }
                connection.send(response);
            }
            log.debug("Daemon closed the subscriber connection");
        } catch (IOException e) {
            if (!connection.isClosed()) {
                log.debug("Subscriber connection lost: {}", e.getMessage());
            }
        }
    }

    private JsonNode handle(RpcRequest request) throws IOException {
        String method = request.method() != null ? request.method() : "";
        switch (method) {
            case "session_changed" -> callback.sessionChanged(
                    objectMapper.treeToValue(request.param("record"), SessionRecord.class));
            case "daemon_restarting" -> callback.daemonRestarting(request.textParam("new_sha"));
            case "ping" -> {
                return objectMapper.getNodeFactory().booleanNode(callback.ping());
            }
            default -> log.debug("Ignoring unknown callback {}", method);
        }
        return objectMapper.nullNode();
    }

    public boolean isConnected() {
        return reader.isAlive() && !connection.isClosed();
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Error closing subscriber connection: {}", e.getMessage());
        }
    }
}
