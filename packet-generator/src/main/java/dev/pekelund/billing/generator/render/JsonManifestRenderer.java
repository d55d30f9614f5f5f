package dev.pekelund.billing.generator.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.billing.fingerprint.Fingerprint;
import dev.pekelund.billing.grouping.Packet;
import dev.pekelund.billing.grouping.PacketKey;
import dev.pekelund.billing.pipeline.PacketRenderer;
import dev.pekelund.billing.pipeline.PacketRenderingException;
import dev.pekelund.billing.pipeline.RenderedArtifact;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each generated packet as a JSON manifest named
 * {@code WR_<wr>_WeekEnding_<MMddyy>[_Helper_<name>]_<fingerprint>.json}. Older manifests of the
 * same packet are removed once the new one is in place.
 */
public class JsonManifestRenderer implements PacketRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonManifestRenderer.class);
    private static final String EXTENSION = ".json";

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonManifestRenderer(Path outputDirectory, ObjectMapper objectMapper, Clock clock) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public RenderedArtifact render(Packet packet, Fingerprint fingerprint) {
        String fileName = baseName(packet.key()) + "_" + fingerprint.value() + EXTENSION;
        Path target = outputDirectory.resolve(fileName);
        try {
            Files.createDirectories(outputDirectory);
            Path temporary = Files.createTempFile(outputDirectory, fileName, ".tmp");
            try {
                objectMapper.writeValue(temporary.toFile(),
                    PacketManifest.of(packet, fingerprint.value(), clock.instant()));
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException | RuntimeException ex) {
                discard(temporary, ex);
                throw ex;
            }
        } catch (IOException ex) {
            throw new PacketRenderingException("Unable to write manifest " + target, ex);
        }
        removeStale(packet.key(), fileName);
        LOGGER.info("Wrote packet manifest {}", target);
        return new RenderedArtifact(fileName);
    }

    static String baseName(PacketKey key) {
        String base = "WR_" + sanitize(key.workRequest()) + "_WeekEnding_" + key.weekCode();
        return key.isHelper() ? base + "_Helper_" + sanitize(key.helperForeman()) : base;
    }

    private static String sanitize(String value) {
        return value.trim().replaceAll("[^A-Za-z0-9.-]+", "_");
    }

    private static void discard(Path temporary, Exception failure) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }

    private void removeStale(PacketKey key, String current) {
        String prefix = baseName(key) + "_";
        try (Stream<Path> entries = Files.list(outputDirectory)) {
            for (Path stale : entries
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(EXTENSION) && !name.equals(current)
                        && name.length() == current.length();
                })
                .toList()) {
                Files.deleteIfExists(stale);
                LOGGER.debug("Removed superseded manifest {}", stale);
            }
        } catch (IOException ex) {
            LOGGER.warn("Unable to remove superseded manifests for {}", key.id(), ex);
        }
    }
}
