package work.tierforge.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.tierforge.error.ConfigException;

/**
 * Artifact types loaded from {@code artifacts.yaml}.
 */
public final class ArtifactRegistry {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final String version;
    private final Map<String, ArtifactDefinition> artifacts;

    public ArtifactRegistry(String version, List<ArtifactDefinition> definitions) {
        var byId = new LinkedHashMap<String, ArtifactDefinition>();
        for (var definition : definitions) {
            if (byId.putIfAbsent(definition.typeId(), definition) != null) {
                throw new IllegalArgumentException("duplicate artifact type '" + definition.typeId() + "'");
            }
        }
        this.version = version == null ? "1.0" : version;
        this.artifacts = Collections.unmodifiableMap(byId);
    }

    public static ArtifactRegistry load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigException(
                "Artifact registry not found",
                path,
                List.of("Create artifacts.yaml with an artifact_types list")
            );
        }
        try {
            return fromYaml(Files.readString(path, StandardCharsets.UTF_8), path);
        } catch (IOException ex) {
            throw new ConfigException("Artifact registry could not be read: " + ex.getMessage(), path, List.of(), ex);
        }
    }

    public static ArtifactRegistry fromYaml(String yaml, Path source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException ex) {
            throw new ConfigException("Artifact registry has invalid syntax", source,
                List.of("Check YAML syntax: " + ex.getOriginalMessage()), ex);
        }
        try {
            if (root == null || !root.isObject() || !root.path("artifact_types").isArray()) {
                throw new IllegalArgumentException("artifact_types must be a list");
            }
            var definitions = new ArrayList<ArtifactDefinition>();
            for (JsonNode node : root.get("artifact_types")) {
                definitions.add(definition(node));
            }
            return new ArtifactRegistry(text(root, "version"), definitions);
        } catch (IllegalArgumentException ex) {
            throw new ConfigException("Artifact registry validation failed: " + ex.getMessage(), source, List.of(), ex);
        }
    }

    private static ArtifactDefinition definition(JsonNode node) {
        String typeId = text(node, "type_id");
        String kindId = text(node, "type");
        var kind = ArtifactKind.fromId(kindId)
            .orElseThrow(() -> new IllegalArgumentException("artifact '" + typeId + "' has unknown type '" + kindId + "'"));
        String outputId = text(node, "output_type");
        var outputType = outputId == null
            ? OutputType.FILE
            : OutputType.fromId(outputId).orElseThrow(
                () -> new IllegalArgumentException("artifact '" + typeId + "' has unknown output_type '" + outputId + "'")
            );
        var required = new ArrayList<String>();
        node.path("required_fields").forEach(field -> required.add(field.asText()));
        return new ArtifactDefinition(
            typeId,
            kind,
            text(node, "name"),
            text(node, "description"),
            outputType,
            text(node, "template_path"),
            text(node, "fallback_template"),
            text(node, "file_extension"),
            text(node, "name_suffix"),
            required
        );
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    public String version() {
        return version;
    }

    /**
     * @throws ConfigException when the type is not registered; the message lists the known types
     */
    public ArtifactDefinition get(String typeId) {
        var definition = artifacts.get(typeId);
        if (definition == null) {
            throw new ConfigException(
                "Unknown artifact type '" + typeId + "'. Available: " + String.join(", ", artifacts.keySet()),
                null,
                List.of("Use one of: " + String.join(", ", artifacts.keySet()))
            );
        }
        return definition;
    }

    public Optional<ArtifactDefinition> find(String typeId) {
        return Optional.ofNullable(artifacts.get(typeId));
    }

    public boolean has(String typeId) {
        return artifacts.containsKey(typeId);
    }

    public List<ArtifactDefinition> list() {
        return List.copyOf(artifacts.values());
    }
}
