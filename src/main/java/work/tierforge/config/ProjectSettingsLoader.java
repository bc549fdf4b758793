package work.tierforge.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.tierforge.error.ConfigException;
import work.tierforge.metadata.ScaffoldMetadataConfig;

/**
 * Reads {@code tierforge.toml}. Relative paths are resolved against the directory holding the file.
 *
 * <pre>
 * [templates]
 * root = "templates"
 *
 * [metadata]
 * config = ".tierforge/scaffold_metadata.yaml"
 *
 * [artifacts]
 * registry = "artifacts.yaml"
 * versions = ".tierforge/template_versions.yaml"
 *
 * [output]
 * root = "."
 * </pre>
 */
public final class ProjectSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(ProjectSettingsLoader.class);

    public static final String FILE_NAME = "tierforge.toml";
    static final String DEFAULT_TEMPLATES = "templates";
    static final String DEFAULT_ARTIFACTS = "artifacts.yaml";
    static final Path DEFAULT_VERSIONS = Path.of(".tierforge", "template_versions.yaml");

    private ProjectSettingsLoader() {}

    /**
     * Finds {@code tierforge.toml} in {@code start} or one of its parents; without one the defaults
     * for {@code start} apply.
     */
    public static ProjectSettings discover(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
            current = current.getParent();
        }
        log.debug("No {} above {}, using defaults", FILE_NAME, start);
        return defaults(start);
    }

    public static ProjectSettings defaults(Path baseDirectory) {
        Path base = baseDirectory.toAbsolutePath().normalize();
        Path metadata = base.resolve(ScaffoldMetadataConfig.DEFAULT_PATH);
        Path artifacts = base.resolve(DEFAULT_ARTIFACTS);
        return new ProjectSettings(
            base,
            base.resolve(DEFAULT_TEMPLATES),
            Files.isRegularFile(metadata) ? metadata : null,
            Files.isRegularFile(artifacts) ? artifacts : null,
            base.resolve(DEFAULT_VERSIONS),
            base
        );
    }

    /**
     * @throws ConfigException when the file is missing or is not valid TOML
     */
    public static ProjectSettings load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigException("Settings file not found", file, List.of("Create " + FILE_NAME + " in the project root"));
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new ConfigException("Settings file could not be read: " + ex.getMessage(), file, List.of(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigException("Settings file has invalid syntax", file, List.of("Check TOML syntax: " + errors));
        }
        Path base = file.toAbsolutePath().normalize().getParent();
        var defaults = defaults(base);
        var settings = new ProjectSettings(
            base,
            path(base, table(result, "templates", file), "root", defaults.templatesRoot()),
            path(base, table(result, "metadata", file), "config", defaults.metadataConfig()),
            path(base, table(result, "artifacts", file), "registry", defaults.artifactRegistry()),
            path(base, table(result, "artifacts", file), "versions", defaults.versionRegistry()),
            path(base, table(result, "output", file), "root", defaults.outputRoot())
        );
        log.debug("Loaded settings from {}", file);
        return settings;
    }

    private static TomlTable table(TomlParseResult result, String key, Path file) {
        if (result.contains(key) && !result.isTable(key)) {
            throw new ConfigException("Settings validation failed: [" + key + "] must be a table", file);
        }
        return result.getTable(key);
    }

    private static Path path(Path base, TomlTable table, String key, Path fallback) {
        if (table == null || !table.contains(key)) {
            return fallback;
        }
        if (!table.isString(key)) {
            throw new ConfigException("Settings validation failed: '" + key + "' must be a string", base.resolve(FILE_NAME));
        }
        String value = table.getString(key);
        return value.isBlank() ? fallback : base.resolve(value).normalize();
    }
}
