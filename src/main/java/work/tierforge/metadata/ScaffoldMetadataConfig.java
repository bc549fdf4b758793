package work.tierforge.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.error.ConfigException;

/**
 * Comment patterns and metadata fields that define what a provenance header looks like. Instances are
 * immutable; {@link #shared(Path)} keeps one per configuration file for the whole process.
 */
public final class ScaffoldMetadataConfig {
    private static final Logger log = LoggerFactory.getLogger(ScaffoldMetadataConfig.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final Path DEFAULT_PATH = Path.of(".tierforge", "scaffold_metadata.yaml");
    static final String DEFAULT_RESOURCE = "/scaffold_metadata.yaml";

    private static final Map<Path, ScaffoldMetadataConfig> SHARED = new HashMap<>();

    private final String version;
    private final List<CommentPattern> patterns;
    private final List<MetadataField> fields;
    private final Map<CommentSyntax, CommentPattern> patternsBySyntax;
    private final Map<String, MetadataField> fieldsByName;
    private final Path source;

    public ScaffoldMetadataConfig(String version, List<CommentPattern> patterns, List<MetadataField> fields, Path source) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("comment_patterns must not be empty");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("metadata_fields must not be empty");
        }
        var bySyntax = new LinkedHashMap<CommentSyntax, CommentPattern>();
        for (var pattern : patterns) {
            if (bySyntax.putIfAbsent(pattern.syntax(), pattern) != null) {
                throw new IllegalArgumentException("duplicate comment pattern for syntax '" + pattern.syntax().id() + "'");
            }
        }
        var byName = new LinkedHashMap<String, MetadataField>();
        for (var field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("duplicate metadata field '" + field.name() + "'");
            }
        }
        this.version = version == null ? "1.0" : version;
        this.patterns = List.copyOf(patterns);
        this.fields = List.copyOf(fields);
        this.patternsBySyntax = Collections.unmodifiableMap(bySyntax);
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.source = source;
    }

    /**
     * Loads a configuration file.
     *
     * @throws ConfigException when the file is missing, is not valid YAML, or fails validation
     */
    public static ScaffoldMetadataConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigException(
                "Config file not found",
                path,
                List.of("Create " + DEFAULT_PATH + " with comment_patterns and metadata_fields")
            );
        }
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfigException("Config file could not be read: " + ex.getMessage(), path, List.of(), ex);
        }
        var config = fromYaml(text, path);
        log.debug("Loaded scaffold metadata config from {}", path);
        return config;
    }

    /**
     * Like {@link #load(Path)} but reports failure in the result instead of throwing.
     */
    public static ConfigLoadResult tryLoad(Path path) {
        try {
            return ConfigLoadResult.success(load(path));
        } catch (ConfigException ex) {
            return ConfigLoadResult.failure(ex);
        }
    }

    /**
     * The configuration bundled with the library.
     */
    public static ScaffoldMetadataConfig defaults() {
        try (InputStream in = ScaffoldMetadataConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigException("Bundled config resource missing: " + DEFAULT_RESOURCE);
            }
            return fromYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8), null);
        } catch (IOException ex) {
            throw new ConfigException("Bundled config could not be read: " + ex.getMessage(), null, List.of(), ex);
        }
    }

    public static ScaffoldMetadataConfig fromYaml(String yaml, Path source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException ex) {
            throw new ConfigException(
                "Config has invalid syntax",
                source,
                List.of("Check YAML syntax: " + ex.getOriginalMessage()),
                ex
            );
        }
        try {
            return fromTree(root, source);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException(
                "Config validation failed: " + ex.getMessage(),
                source,
                List.of("Check schema compliance: comment_patterns and metadata_fields must be non-empty lists"),
                ex
            );
        }
    }

    private static ScaffoldMetadataConfig fromTree(JsonNode root, Path source) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("document must be a mapping");
        }
        var patterns = new ArrayList<CommentPattern>();
        for (JsonNode node : list(root, "comment_patterns")) {
            String syntaxId = text(node, "syntax");
            var syntax = CommentSyntax.fromId(syntaxId)
                .orElseThrow(() -> new IllegalArgumentException("unknown comment syntax '" + syntaxId + "'"));
            var extensions = new ArrayList<String>();
            node.path("extensions").forEach(ext -> extensions.add(ext.asText()));
            patterns.add(new CommentPattern(
                syntax,
                text(node, "prefix"),
                text(node, "metadata_line_regex"),
                text(node, "filepath_line_regex"),
                extensions
            ));
        }
        var fields = new ArrayList<MetadataField>();
        for (JsonNode node : list(root, "metadata_fields")) {
            JsonNode required = node.get("required");
            if (required == null || !required.isBoolean()) {
                throw new IllegalArgumentException("metadata field '" + text(node, "name") + "' needs a boolean 'required'");
            }
            fields.add(new MetadataField(text(node, "name"), text(node, "format_regex"), required.booleanValue()));
        }
        return new ScaffoldMetadataConfig(text(root, "version"), patterns, fields, source);
    }

    private static List<JsonNode> list(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException(key + " must be a list");
        }
        var items = new ArrayList<JsonNode>();
        node.forEach(items::add);
        return items;
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Process-wide instance for {@code path}; the file is read on first use only.
     */
    public static synchronized ScaffoldMetadataConfig shared(Path path) {
        Path key = path.toAbsolutePath().normalize();
        var existing = SHARED.get(key);
        if (existing != null) {
            return existing;
        }
        var loaded = load(path);
        SHARED.put(key, loaded);
        return loaded;
    }

    /**
     * Process-wide instance for {@link #DEFAULT_PATH}, falling back to the bundled defaults when the
     * working directory has no configuration.
     */
    public static synchronized ScaffoldMetadataConfig shared() {
        if (Files.isRegularFile(DEFAULT_PATH)) {
            return shared(DEFAULT_PATH);
        }
        return SHARED.computeIfAbsent(Path.of(DEFAULT_RESOURCE), key -> defaults());
    }

    public static synchronized void resetShared() {
        SHARED.clear();
    }

    public String version() {
        return version;
    }

    public List<CommentPattern> patterns() {
        return patterns;
    }

    public List<MetadataField> fields() {
        return fields;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public Optional<CommentPattern> getPattern(CommentSyntax syntax) {
        return Optional.ofNullable(patternsBySyntax.get(syntax));
    }

    public Optional<CommentPattern> getPattern(String syntaxId) {
        return CommentSyntax.fromId(syntaxId).flatMap(this::getPattern);
    }

    public Optional<MetadataField> getField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    /**
     * Syntax used for files with {@code extension}: a pattern listing the extension explicitly wins over
     * the default extension table.
     */
    public Optional<CommentSyntax> syntaxForExtension(String extension) {
        String normalized = CommentSyntax.normalizeExtension(extension);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (var pattern : patterns) {
            if (pattern.extensions().contains(normalized)) {
                return Optional.of(pattern.syntax());
            }
        }
        return CommentSyntax.forExtension(normalized);
    }

    public Optional<CommentPattern> patternForExtension(String extension) {
        return syntaxForExtension(extension).flatMap(this::getPattern);
    }
}
