package work.tierforge.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Artifact type declared in {@code artifacts.yaml}: which template produces it and how its output is
 * named.
 */
public record ArtifactDefinition(
    String typeId,
    ArtifactKind kind,
    String name,
    String description,
    OutputType outputType,
    String templatePath,
    String fallbackTemplate,
    String fileExtension,
    String nameSuffix,
    List<String> requiredFields
) {
    private static final Pattern TYPE_ID = Pattern.compile("[a-z0-9_]+");

    public ArtifactDefinition {
        if (typeId == null || !TYPE_ID.matcher(typeId).matches()) {
            throw new IllegalArgumentException(
                "type_id '" + typeId + "' must be lowercase alphanumerics with underscores, e.g. 'dto' or 'research_doc'"
            );
        }
        Objects.requireNonNull(kind, "kind");
        outputType = outputType == null ? OutputType.FILE : outputType;
        if (fileExtension == null || fileExtension.isBlank()) {
            throw new IllegalArgumentException("artifact '" + typeId + "' needs a file_extension");
        }
        if (templatePath == null && fallbackTemplate == null) {
            throw new IllegalArgumentException("artifact '" + typeId + "' needs a template_path");
        }
        name = name == null ? typeId : name;
        description = description == null ? "" : description;
        nameSuffix = nameSuffix == null ? "" : nameSuffix;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public String fileName(String baseName) {
        return baseName + nameSuffix + fileExtension;
    }
}
