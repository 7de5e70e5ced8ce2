package com.planforge.daemon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;

/**
 * Persists the whole session registry as one JSON array, rewritten on every change.
 */
public class RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryStore.class);

    private static final TypeReference<List<SessionRecord>> RECORDS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public RegistryStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the persisted records. A missing file yields an empty list; an unreadable one is
     * logged and also yields an empty list, since the registry is rebuilt by live sessions
     * re-registering.
     */
    public List<SessionRecord> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<SessionRecord> records = objectMapper.readValue(file.toFile(), RECORDS);
            return records != null ? records : List.of();
        } catch (IOException e) {
            log.warn("Ignoring unreadable session registry {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Replaces the file with {@code records}.
     *
     * @throws DaemonException {@code INTERNAL} if the file cannot be written
     */
    public void save(Collection<SessionRecord> records) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            Files.write(temp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(List.copyOf(records)));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw DaemonException.internal("failed to persist session registry " + file, e);
        }
    }
}
