package work.tierforge.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one runner call: where the project lives and what to scaffold.
 */
public record ScaffoldRunConfiguration(
    Path workingDirectory,
    Optional<Path> settingsFile,
    Optional<Path> templatesRoot,
    Optional<Path> outputRoot,
    String artifactType,
    String templateName,
    String name,
    Map<String, Object> values,
    Path outputPath,
    boolean write,
    boolean validateOnly,
    LogLevel logLevel
) {
    public ScaffoldRunConfiguration {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(templatesRoot, "templatesRoot");
        Objects.requireNonNull(outputRoot, "outputRoot");
        Objects.requireNonNull(logLevel, "logLevel");
        if (artifactType == null && templateName == null) {
            throw new IllegalArgumentException("artifactType or templateName is required");
        }
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Artifact type when given, otherwise the template name.
     */
    public String target() {
        return artifactType != null ? artifactType : templateName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workingDirectory = Path.of(".");
        private Optional<Path> settingsFile = Optional.empty();
        private Optional<Path> templatesRoot = Optional.empty();
        private Optional<Path> outputRoot = Optional.empty();
        private String artifactType;
        private String templateName;
        private String name;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private Path outputPath;
        private boolean write;
        private boolean validateOnly;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = Optional.ofNullable(settingsFile);
            return this;
        }

        public Builder templatesRoot(Path templatesRoot) {
            this.templatesRoot = Optional.ofNullable(templatesRoot);
            return this;
        }

        public Builder outputRoot(Path outputRoot) {
            this.outputRoot = Optional.ofNullable(outputRoot);
            return this;
        }

        public Builder artifactType(String artifactType) {
            this.artifactType = artifactType;
            return this;
        }

        public Builder templateName(String templateName) {
            this.templateName = templateName;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(String key, Object value) {
            this.values.put(key, value);
            return this;
        }

        public Builder values(Map<String, ?> values) {
            if (values != null) {
                this.values.putAll(values);
            }
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder write(boolean write) {
            this.write = write;
            return this;
        }

        public Builder validateOnly(boolean validateOnly) {
            this.validateOnly = validateOnly;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ScaffoldRunConfiguration build() {
            return new ScaffoldRunConfiguration(
                workingDirectory,
                settingsFile,
                templatesRoot,
                outputRoot,
                artifactType,
                templateName,
                name,
                values,
                outputPath,
                write,
                validateOnly,
                logLevel
            );
        }
    }
}
