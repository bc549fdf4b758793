package work.tierforge.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved project layout. Every path is absolute; optional entries are {@code null} when the project
 * does not use them.
 */
public record ProjectSettings(
    Path baseDirectory,
    Path templatesRoot,
    Path metadataConfig,
    Path artifactRegistry,
    Path versionRegistry,
    Path outputRoot
) {
    public ProjectSettings {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(templatesRoot, "templatesRoot");
        Objects.requireNonNull(outputRoot, "outputRoot");
    }

    public Optional<Path> metadataConfigPath() {
        return Optional.ofNullable(metadataConfig);
    }

    public Optional<Path> artifactRegistryPath() {
        return Optional.ofNullable(artifactRegistry);
    }

    public Optional<Path> versionRegistryPath() {
        return Optional.ofNullable(versionRegistry);
    }

    public ProjectSettings withTemplatesRoot(Path templatesRoot) {
        return new ProjectSettings(baseDirectory, templatesRoot, metadataConfig, artifactRegistry, versionRegistry, outputRoot);
    }

    public ProjectSettings withOutputRoot(Path outputRoot) {
        return new ProjectSettings(baseDirectory, templatesRoot, metadataConfig, artifactRegistry, versionRegistry, outputRoot);
    }
}
