package io.herald.core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON file ledger. Every write replaces the whole document through a temp file and an atomic rename,
 * so a crash mid-write leaves the previous document intact. Membership is served from an in-memory index
 * that is reloaded whenever the file changes on disk.
 *
 * <p>The parent directory is forced after the rename where the platform allows it. Where it does not,
 * a power loss right after {@link #record(String)} may roll the ledger back to the previous document,
 * and the item is published once more.
 */
public final class FileDedupLedger implements DedupLedger {
    private static final Logger LOG = LoggerFactory.getLogger(FileDedupLedger.class);

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;

    private Map<String, LedgerEntry> index;
    private Stamp loadedStamp;

    public FileDedupLedger(Path path) {
        this(path, Clock.systemUTC());
    }

    public FileDedupLedger(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized boolean contains(String key) throws LedgerStorageException {
        return entries().containsKey(DedupLedger.normalizeKey(key));
    }

    @Override
    public synchronized boolean record(String key) throws LedgerStorageException {
        String normalized = DedupLedger.normalizeKey(key);
        Map<String, LedgerEntry> current = entries();
        if (current.containsKey(normalized)) {
            return false;
        }
        Map<String, LedgerEntry> updated = new LinkedHashMap<>(current);
        updated.put(normalized, new LedgerEntry(normalized, clock.instant()));
        write(new LedgerState(LedgerState.CURRENT_VERSION, new ArrayList<>(updated.values())));
        index = updated;
        loadedStamp = stamp();
        return true;
    }

    @Override
    public synchronized int size() throws LedgerStorageException {
        return entries().size();
    }

    public Path path() {
        return path;
    }

    private Map<String, LedgerEntry> entries() throws LedgerStorageException {
        Stamp current = stamp();
        if (index != null && Objects.equals(current, loadedStamp)) {
            return index;
        }
        if (current == null) {
            index = Collections.emptyMap();
            loadedStamp = null;
            return index;
        }

        LedgerState state;
        try {
            state = mapper.readValue(Files.readAllBytes(path), LedgerState.class);
        } catch (JsonProcessingException e) {
            throw new LedgerStorageException("Dedup ledger is corrupt: " + path, e);
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to read dedup ledger " + path, e);
        }
        if (state == null) {
            throw new LedgerStorageException("Dedup ledger is empty: " + path);
        }

        Map<String, LedgerEntry> loaded = new LinkedHashMap<>();
        for (LedgerEntry entry : state.entries()) {
            loaded.putIfAbsent(entry.key(), entry);
        }
        index = loaded;
        loadedStamp = current;
        return index;
    }

    private void write(LedgerState state) throws LedgerStorageException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] json = (mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state) + System.lineSeparator())
                .getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(
                tmp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
            )) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            if (parent != null) {
                forceDirectory(parent);
            }
        } catch (IOException e) {
            LedgerStorageException failure = new LedgerStorageException("Failed to write dedup ledger " + path, e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }

    private static void forceDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // Windows refuses to open directories.
            LOG.debug("Could not force ledger directory {}: {}", directory, e.getMessage());
        }
    }

    private Stamp stamp() throws LedgerStorageException {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return new Stamp(Files.getLastModifiedTime(path), Files.size(path));
        } catch (IOException e) {
            throw new LedgerStorageException("Failed to stat dedup ledger " + path, e);
        }
    }

    private record Stamp(FileTime modified, long size) {
    }
}
