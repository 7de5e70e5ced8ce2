package com.planforge.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.model.WorkflowId;
import com.planforge.core.workflow.WorkflowAggregate;
import com.planforge.core.workflow.WorkflowEvent;
import com.planforge.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSONL event log with periodic snapshots.
 * <p>
 * Each event is one line of the log file. Commits take an exclusive lock on the log,
 * verify that nobody else appended since the caller loaded its state, write the new lines
 * and fsync them. Only then are the events applied to the in-memory aggregate, so observed
 * state never runs ahead of durable state.
 * <p>
 * The snapshot file holds the full aggregate state at some sequence and is replaced
 * atomically. Loading starts from the snapshot and replays the newer events; the result is
 * the same as replaying the whole log.
 */
public class FileEventStore {

    private static final Logger log = LoggerFactory.getLogger(FileEventStore.class);

    /** Serializes commits within this JVM; {@link FileLock} only guards against other processes. */
    private static final ConcurrentHashMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path logPath;
    private final Path snapshotPath;
    private final int snapshotEvery;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, LogPosition> positions = new ConcurrentHashMap<>();

    public FileEventStore(Path logPath, Path snapshotPath, int snapshotEvery) {
        this(logPath, snapshotPath, snapshotEvery, JsonSupport.newObjectMapper(), Clock.systemUTC());
    }

    public FileEventStore(Path logPath, Path snapshotPath, int snapshotEvery, ObjectMapper objectMapper, Clock clock) {
        this.logPath = logPath.toAbsolutePath().normalize();
        this.snapshotPath = snapshotPath.toAbsolutePath().normalize();
        this.snapshotEvery = snapshotEvery;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Whether a snapshot is due at {@code sequence}. A non-positive {@code everyN} disables snapshots.
     */
    public static boolean shouldSnapshot(long sequence, int everyN) {
        return everyN > 0 && sequence % everyN == 0;
    }

    public Path logPath() {
        return logPath;
    }

    public Path snapshotPath() {
        return snapshotPath;
    }

    // -- Loading -------------------------------------------------------------

    /**
     * Rebuilds the aggregate from the latest snapshot plus every later event.
     *
     * @throws WorkflowException with {@code STORAGE_FAILURE} if the log or snapshot cannot be read
     */
    public AggregateContext loadAggregate(WorkflowId aggregateId) {
        StoredSnapshot snapshot = loadSnapshot(aggregateId);
        WorkflowAggregate aggregate = snapshot != null
                ? WorkflowAggregate.fromSnapshot(snapshot.state())
                : new WorkflowAggregate();
        long fromSequence = snapshot != null ? snapshot.sequence() : 0;

        List<StoredEvent> events = loadEvents(aggregateId);
        long current = fromSequence;
        for (StoredEvent stored : events) {
            if (stored.sequence() > fromSequence) {
                aggregate.apply(stored.payload());
            }
            current = Math.max(current, stored.sequence());
        }
        log.debug("Loaded aggregate {} at sequence {} (snapshot at {}, {} events in log)",
                aggregateId, current, fromSequence, events.size());
        return new AggregateContext(aggregateId, aggregate, current);
    }

    /**
     * Reads every event of one aggregate in log order, checking type, version and sequence continuity.
     */
    public List<StoredEvent> loadEvents(WorkflowId aggregateId) {
        List<StoredEvent> events = new ArrayList<>();
        String id = aggregateId.toString();
        long expected = 1;
        try (BufferedReader reader = Files.newBufferedReader(logPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                StoredEvent stored = parseLine(line, lineNumber);
                if (!id.equals(stored.aggregateId())) {
                    continue;
                }
                validate(stored, lineNumber);
                if (stored.sequence() != expected) {
                    throw WorkflowException.storageFailure("event log " + logPath + " line " + lineNumber
                            + ": expected sequence " + expected + " but found " + stored.sequence(), null);
                }
                expected++;
                events.add(stored);
            }
        } catch (NoSuchFileException e) {
            return events;
        } catch (IOException e) {
            throw WorkflowException.storageFailure("failed to read event log " + logPath, e);
        }
        return events;
    }

    StoredSnapshot loadSnapshot(WorkflowId aggregateId) {
        if (!Files.exists(snapshotPath)) {
            return null;
        }
        try {
            StoredSnapshot snapshot = objectMapper.readValue(snapshotPath.toFile(), StoredSnapshot.class);
            if (!aggregateId.toString().equals(snapshot.aggregateId())) {
                log.warn("Ignoring snapshot {} for aggregate {}, expected {}",
                        snapshotPath, snapshot.aggregateId(), aggregateId);
                return null;
            }
            return snapshot;
        } catch (IOException e) {
            throw WorkflowException.storageFailure("failed to read snapshot " + snapshotPath, e);
        }
    }

    private StoredEvent parseLine(String line, int lineNumber) {
        try {
            return objectMapper.readValue(line, StoredEvent.class);
        } catch (JsonProcessingException e) {
            throw WorkflowException.storageFailure(
                    "unparseable event at " + logPath + " line " + lineNumber + ": " + e.getOriginalMessage(), e);
        }
    }

    private void validate(StoredEvent stored, int lineNumber) {
        if (stored.payload() == null) {
            throw WorkflowException.storageFailure("event at line " + lineNumber + " has no payload", null);
        }
        if (!stored.payload().eventType().equals(stored.eventType())) {
            throw WorkflowException.storageFailure("event at line " + lineNumber + " declares type "
                    + stored.eventType() + " but holds " + stored.payload().eventType(), null);
        }
        if (!WorkflowEvent.EVENT_VERSION.equals(stored.eventVersion())) {
            throw WorkflowException.storageFailure("event at line " + lineNumber
                    + " has unsupported version " + stored.eventVersion(), null);
        }
    }

    // -- Writing -------------------------------------------------------------

    /**
     * Appends events after {@code context.currentSequence()}, applies them to the context's aggregate
     * and writes a snapshot if one falls due.
     *
     * @return the stored events, in order, and the context advanced to the last of them
     * @throws WorkflowException {@code CONCURRENCY_CONFLICT} if the log moved on since the context was loaded,
     *                           {@code STORAGE_FAILURE} on I/O errors; the aggregate is unchanged in both cases
     */
    public CommitResult commit(AggregateContext context, List<WorkflowEvent> events, Map<String, String> metadata) {
        if (events.isEmpty()) {
            return new CommitResult(context, List.of());
        }
        List<StoredEvent> stored = append(context.aggregateId(), context.currentSequence(), events, metadata);
        for (StoredEvent event : stored) {
            context.aggregate().apply(event.payload());
        }
        long newSequence = stored.get(stored.size() - 1).sequence();
        AggregateContext advanced = context.advancedTo(newSequence);

        if (stored.stream().anyMatch(e -> shouldSnapshot(e.sequence(), snapshotEvery))) {
            writeSnapshot(advanced);
        }
        return new CommitResult(advanced, stored);
    }

    /**
     * Appends events to the log, numbering them after {@code expectedSequence}.
     */
    public List<StoredEvent> append(WorkflowId aggregateId, long expectedSequence, List<WorkflowEvent> events,
                                    Map<String, String> metadata) {
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(logPath, p -> new ReentrantLock());
        processLock.lock();
        try {
            Files.createDirectories(logPath.getParent());
            try (FileChannel channel = FileChannel.open(logPath, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND);
                 FileLock ignored = channel.lock()) {

                long lastPersisted = lastSequence(aggregateId, channel.size());
                if (lastPersisted != expectedSequence) {
                    throw WorkflowException.concurrencyConflict("aggregate " + aggregateId + " is at sequence "
                            + lastPersisted + " but the writer expected " + expectedSequence);
                }

                List<StoredEvent> stored = new ArrayList<>(events.size());
                StringBuilder lines = new StringBuilder();
                long sequence = expectedSequence;
                for (WorkflowEvent event : events) {
                    sequence++;
                    var record = new StoredEvent(aggregateId.toString(), sequence, clock.instant(),
                            event.eventType(), event.eventVersion(), event,
                            metadata != null ? Map.copyOf(metadata) : Map.of());
                    lines.append(objectMapper.writeValueAsString(record)).append('\n');
                    stored.add(record);
                }
                ByteBuffer buffer = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
                positions.put(aggregateId.toString(), new LogPosition(channel.size(), sequence));
                log.debug("Appended {} event(s) to {} for {}, now at sequence {}",
                        stored.size(), logPath.getFileName(), aggregateId, sequence);
                return stored;
            }
        } catch (IOException e) {
            throw WorkflowException.storageFailure("failed to append to event log " + logPath, e);
        } finally {
            processLock.unlock();
        }
    }

    /**
     * Last persisted sequence of an aggregate. The log is only read again when its size differs
     * from what this store last wrote, that is when another writer has appended.
     */
    private long lastSequence(WorkflowId aggregateId, long logSize) {
        String id = aggregateId.toString();
        LogPosition known = positions.get(id);
        if (known != null && known.logSize() == logSize) {
            return known.sequence();
        }
        List<StoredEvent> existing = loadEvents(aggregateId);
        long last = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).sequence();
        positions.put(id, new LogPosition(logSize, last));
        return last;
    }

    /**
     * Replaces the snapshot file with the given state. Failures are logged only, since the log
     * alone is enough to recover.
     */
    void writeSnapshot(AggregateContext context) {
        var snapshot = new StoredSnapshot(context.aggregateId().toString(), context.currentSequence(),
                clock.instant(), context.aggregate().data());
        Path temp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
        try {
            Files.createDirectories(snapshotPath.getParent());
            Files.write(temp, objectMapper.writeValueAsBytes(snapshot));
            try {
                Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote snapshot for {} at sequence {}", context.aggregateId(), context.currentSequence());
        } catch (IOException e) {
            log.warn("Failed to write snapshot {}: {}", snapshotPath, e.getMessage(), e);
        }
    }

    private record LogPosition(long logSize, long sequence) {
    }

    /**
     * Outcome of a successful commit.
     *
     * @param context the context advanced past the new events
     * @param events  the events as written to the log
     */
    public record CommitResult(AggregateContext context, List<StoredEvent> events) {
    }
}
