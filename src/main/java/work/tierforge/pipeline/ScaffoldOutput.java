package work.tierforge.pipeline;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.tierforge.introspect.TemplateSchema;

/**
 * Result of a successful scaffold. {@code outputPath} is {@code null} for ephemeral output.
 */
public record ScaffoldOutput(
    String artifactType,
    String templateName,
    String content,
    String fileName,
    Path outputPath,
    String versionHash,
    TemplateSchema schema,
    boolean written
) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("artifact_type", artifactType);
        map.put("template", templateName);
        map.put("file_name", fileName);
        map.put("output_path", outputPath == null ? null : outputPath.toString());
        map.put("version", versionHash);
        map.put("written", written);
        map.put("schema", schema.toMap());
        map.put("content", content);
        return map;
    }
}
