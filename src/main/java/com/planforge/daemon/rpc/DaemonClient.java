package com.planforge.daemon.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planforge.daemon.DaemonError;
import com.planforge.daemon.DaemonException;
import com.planforge.daemon.DaemonPaths;
import com.planforge.daemon.PortFile;
import com.planforge.daemon.SessionRecord;
import com.planforge.daemon.files.FileAccessError;
import com.planforge.daemon.files.FileAccessException;
import com.planforge.daemon.files.FileEntry;
import com.planforge.daemon.files.FileReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking client for the daemon's RPC endpoint.
 * <p>
 * Every call waits at most the deadline given at connect time. A call that times out may
 * still have taken effect on the daemon. Calls on one client are serialized.
 */
public class DaemonClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DaemonClient.class);

    private static final TypeReference<List<SessionRecord>> RECORDS = new TypeReference<>() {};
    private static final TypeReference<List<FileEntry>> ENTRIES = new TypeReference<>() {};

    private final JsonLineConnection connection;
    private final ObjectMapper objectMapper;
    private final AtomicLong nextId = new AtomicLong();

    DaemonClient(JsonLineConnection connection, ObjectMapper objectMapper) {
        this.connection = connection;
        this.objectMapper = objectMapper;
    }

    /**
     * Finds the daemon through the port file under {@code home}, connects and authenticates.
     *
     * @throws IOException if there is no port file or the daemon cannot be reached
     */
    public static DaemonClient connect(Path home, Duration deadline, ObjectMapper objectMapper) throws IOException {
        PortFile portFile = PortFile.read(new DaemonPaths(home).portFile(), objectMapper);
        DaemonClient client = open(portFile.port(), deadline, objectMapper);
        try {
            client.authenticate(portFile.token());
        } catch (DaemonException e) {
            client.close();
            throw e;
        }
        return client;
    }

    /**
     * Connects without authenticating; enough for the version and upgrade calls.
     */
    public static DaemonClient connectUnauthenticated(Path home, Duration deadline, ObjectMapper objectMapper)
            throws IOException {
        PortFile portFile = PortFile.read(new DaemonPaths(home).portFile(), objectMapper);
        return open(portFile.port(), deadline, objectMapper);
    }

    public static DaemonClient open(int port, Duration deadline, ObjectMapper objectMapper) throws IOException {
        int timeoutMs = (int) Math.max(1, deadline.toMillis());
        var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            return new DaemonClient(new JsonLineConnection(socket, objectMapper), objectMapper);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    // -- Session registry ----------------------------------------------------

    public void authenticate(String token) {
        call("authenticate", params().put("token", token));
    }

    /**
     * @return the daemon's build SHA
     */
    public String register(SessionRecord record) {
        return call("register", params().set("record", objectMapper.valueToTree(record))).asText();
    }

    /**
     * @return the daemon's build SHA
     */
    public String update(SessionRecord record) {
        return call("update", params().set("record", objectMapper.valueToTree(record))).asText();
    }

    public void heartbeat(String sessionId) {
        call("heartbeat", params().put("session_id", sessionId));
    }

    public List<SessionRecord> list() {
        return convert(call("list", null), RECORDS);
    }

    public void forceStop(String sessionId) {
        call("force_stop", params().put("session_id", sessionId));
    }

    public void shutdown() {
        call("shutdown", null);
    }

    // -- Version negotiation -------------------------------------------------

    public String buildSha() {
        return call("build_sha", null).asText();
    }

    public long buildTimestamp() {
        return call("build_timestamp", null).asLong();
    }

    /**
     * Asks the daemon to retire in favour of a build made at {@code callerTimestamp}.
     *
     * @return whether the daemon agreed and is shutting down
     */
    public boolean requestUpgrade(long callerTimestamp) {
        return call("request_upgrade", params().put("timestamp", callerTimestamp)).asBoolean();
    }

    // -- Session files -------------------------------------------------------

    public List<FileEntry> listSessionFiles(String sessionId) {
        return convert(call("list_session_files", params().put("session_id", sessionId)), ENTRIES);
    }

    public FileReadResult readSessionFile(String sessionId, String filename) {
        JsonNode result = call("read_session_file",
                params().put("session_id", sessionId).put("filename", filename));
        try {
            return objectMapper.treeToValue(result, FileReadResult.class);
        } catch (JsonProcessingException e) {
            throw DaemonException.internal("malformed file content: " + e.getOriginalMessage(), e);
        }
    }

    // -- Plumbing ------------------------------------------------------------

    private ObjectNode params() {
        return objectMapper.createObjectNode();
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) {
        try {
            return objectMapper.readValue(objectMapper.treeAsTokens(node), type);
        } catch (IOException e) {
            throw DaemonException.internal("malformed response: " + e.getMessage(), e);
        }
    }

    synchronized JsonNode call(String method, JsonNode params) {
        long id = nextId.incrementAndGet();
        try {
            connection.send(new RpcRequest(id, method, params));
            RpcResponse response;
            do {
                response = connection.read(RpcResponse.class);
            } while (response != null && response.id() != id);
            if (response == null) {
                throw DaemonException.internal("daemon closed the connection during " + method, null);
            }
            if (response.isError()) {
                throw toException(method, response.error());
            }
            return response.result() != null ? response.result() : objectMapper.nullNode();
        } catch (SocketTimeoutException e) {
            throw DaemonException.internal("deadline exceeded waiting for " + method, e);
        } catch (IOException e) {
            throw DaemonException.internal("RPC " + method + " failed: " + e.getMessage(), e);
        }
    }

    private static RuntimeException toException(String method, RpcError error) {
        if (method.endsWith("_session_files") || method.equals("read_session_file")) {
            FileAccessError fileError = parse(FileAccessError.class, error.type());
            if (fileError != null) {
                return new FileAccessException(fileError, error.message());
            }
        }
        DaemonError daemonError = parse(DaemonError.class, error.type());
        if (daemonError == null) {
            log.debug("Unknown error type {} from daemon", error.type());
            daemonError = DaemonError.INTERNAL;
        }
        return new DaemonException(daemonError, error.message(), error.sessionId(), error.existingPid(), null);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String name) {
        if (name == null) {
            return null;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(name)) {
                return constant;
            }
        }
        return null;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Error closing daemon connection: {}", e.getMessage());
        }
    }
}
