package dev.pekelund.billing.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * History kept in a single JSON object file keyed by packet id. Every change rewrites the file
 * through a temporary file and an atomic move, so a crash never leaves a half-written history.
 */
public class JsonFileHistoryStore implements HistoryStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileHistoryStore.class);
    private static final TypeReference<TreeMap<String, HistoryRecord>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileHistoryStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .enable(SerializationFeature.INDENT_OUTPUT);
        LOGGER.info("JsonFileHistoryStore initialized with history file '{}'", file);
    }

    @Override
    public synchronized Map<String, HistoryRecord> loadAll() {
        return Collections.unmodifiableMap(read());
    }

    @Override
    public synchronized Optional<HistoryRecord> find(String packetId) {
        return Optional.ofNullable(read().get(packetId));
    }

    @Override
    public synchronized boolean compareAndSet(String packetId, HistoryRecord expected, HistoryRecord replacement) {
        Objects.requireNonNull(replacement, "replacement");
        TreeMap<String, HistoryRecord> records = read();
        HistoryRecord current = records.get(packetId);
        if (!Objects.equals(current, expected)) {
            LOGGER.warn("History for {} changed since it was read; not overwriting", packetId);
            return false;
        }
        records.put(packetId, replacement);
        write(records);
        return true;
    }

    @Override
    public synchronized boolean reset(String packetId) {
        TreeMap<String, HistoryRecord> records = read();
        if (records.remove(packetId) == null) {
            return false;
        }
        write(records);
        LOGGER.info("Reset history for {}", packetId);
        return true;
    }

    @Override
    public synchronized void resetAll() {
        write(new TreeMap<>());
        LOGGER.info("Reset all history in {}", file);
    }

    private TreeMap<String, HistoryRecord> read() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, HistoryRecord> records = objectMapper.readValue(file.toFile(), HISTORY_TYPE);
            return records != null ? records : new TreeMap<>();
        } catch (IOException ex) {
            throw new HistoryStoreException("Failed to read history file " + file, ex);
        }
    }

    private void write(TreeMap<String, HistoryRecord> records) {
        try {
            Path directory = file.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temporary = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temporary.toFile(), records);
                replace(temporary);
            } catch (IOException | RuntimeException ex) {
                discard(temporary, ex);
                throw ex;
            }
        } catch (IOException ex) {
            throw new HistoryStoreException("Failed to write history file " + file, ex);
        }
    }

    private void replace(Path temporary) throws IOException {
        try {
            Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.debug("Atomic move not supported for {}; replacing non-atomically", file);
            Files.move(temporary, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temporary, Exception failure) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
