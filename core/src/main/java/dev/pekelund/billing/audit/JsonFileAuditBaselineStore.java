package dev.pekelund.billing.audit;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit baseline kept in a JSON state file holding the last audit time and summary. A missing file
 * means there is no baseline yet; an unreadable one is reported and treated the same way so the
 * audit still runs.
 */
public class JsonFileAuditBaselineStore implements AuditBaselineStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileAuditBaselineStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileAuditBaselineStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<AuditSummary> loadPrevious() {
        if (!Files.exists(file)) {
            LOGGER.info("No audit baseline at {}; trend starts from this run", file);
            return Optional.empty();
        }
        try {
            AuditState state = objectMapper.readValue(file.toFile(), AuditState.class);
            return Optional.ofNullable(state != null ? state.summary() : null);
        } catch (IOException ex) {
            LOGGER.warn("Ignoring unreadable audit baseline {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(AuditSummary summary) {
        Objects.requireNonNull(summary, "summary");
        try {
            Path directory = file.toAbsolutePath().getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temporary = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temporary.toFile(), new AuditState(summary.auditedAt(), summary));
                replace(temporary);
            } catch (IOException | RuntimeException ex) {
                discard(temporary, ex);
                throw ex;
            }
            LOGGER.info("Saved audit baseline to {}", file);
        } catch (IOException ex) {
            throw new AuditStateException("Failed to write audit baseline " + file, ex);
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

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AuditState(
        @JsonProperty("last_audit_time") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant lastAuditTime,
        @JsonProperty("audit_summary") AuditSummary summary
    ) {
    }
}
