package com.planforge.daemon.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * A socket speaking newline-delimited JSON. Reads and writes are each serialized, so one
 * reader and one writer thread may use it at the same time.
 */
public class JsonLineConnection implements AutoCloseable {

    /** Enough for a full file read reply with every character escaped. */
    public static final int DEFAULT_MAX_LINE_CHARS = 8 * 1024 * 1024;

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final ObjectMapper objectMapper;
    private final int maxLineChars;

    public JsonLineConnection(Socket socket, ObjectMapper objectMapper) throws IOException {
        this(socket, objectMapper, DEFAULT_MAX_LINE_CHARS);
    }

    public JsonLineConnection(Socket socket, ObjectMapper objectMapper, int maxLineChars) throws IOException {
        this.socket = socket;
        this.objectMapper = objectMapper;
        this.maxLineChars = maxLineChars;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public void send(Object message) throws IOException {
        String line = objectMapper.writeValueAsString(message);
        synchronized (writer) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    /**
     * Next non-blank line, or {@code null} at end of stream.
     *
     * @throws LineTooLongException if the line is longer than the configured limit; the
     *                              connection is unusable afterwards
     */
    public String readLine() throws IOException {
        synchronized (reader) {
            String line;
            do {
                line = readBoundedLine();
            } while (line != null && line.isBlank());
            return line;
        }
    }

    private String readBoundedLine() throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                return stripCarriageReturn(line);
            }
            if (line.length() >= maxLineChars) {
                throw new LineTooLongException(maxLineChars);
            }
            line.append((char) c);
        }
        return line.length() > 0 ? stripCarriageReturn(line) : null;
    }

    private static String stripCarriageReturn(StringBuilder line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    public <T> T read(Class<T> type) throws IOException {
        String line = readLine();
        return line != null ? objectMapper.readValue(line, type) : null;
    }

    public void setReadTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    public String remoteAddress() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    public boolean isClosed() {
        return socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    /** A peer sent a line longer than this connection accepts. */
    public static class LineTooLongException extends IOException {

        public LineTooLongException(int maxLineChars) {
            super("line exceeds " + maxLineChars + " characters");
        }
    }
}
