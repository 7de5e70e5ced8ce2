package com.planforge.daemon;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Discovery file written by a running daemon so clients can find and authenticate to it.
 *
 * @param port           main RPC port
 * @param subscriberPort port that serves subscriber callbacks
 * @param token          bearer token for both ports
 */
public record PortFile(
        @JsonProperty("port") int port,
        @JsonProperty("subscriber_port") int subscriberPort,
        @JsonProperty("token") String token) {

    public static PortFile read(Path path, ObjectMapper objectMapper) throws IOException {
        return objectMapper.readValue(path.toFile(), PortFile.class);
    }

    /**
     * Writes the file readable by the owner only, replacing any previous one.
     */
    public void write(Path path, ObjectMapper objectMapper) throws IOException {
        Files.createDirectories(path.getParent());
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.write(temp, objectMapper.writeValueAsBytes(this));
        if (Files.getFileStore(temp).supportsFileAttributeView("posix")) {
            Files.setPosixFilePermissions(temp, PosixFilePermissions.fromString("rw-------"));
        }
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
}
