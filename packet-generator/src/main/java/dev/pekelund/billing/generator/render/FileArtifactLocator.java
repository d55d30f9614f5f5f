package dev.pekelund.billing.generator.render;

import dev.pekelund.billing.decision.ArtifactLocator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Resolves artifact references as file names inside the output directory.
 */
public class FileArtifactLocator implements ArtifactLocator {

    private final Path outputDirectory;

    public FileArtifactLocator(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    @Override
    public boolean exists(String artifactRef) {
        if (!StringUtils.hasText(artifactRef)) {
            return false;
        }
        return Files.isRegularFile(outputDirectory.resolve(artifactRef));
    }
}
