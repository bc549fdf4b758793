package work.tierforge.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scaffold invocation. Either {@code artifactType} or {@code templateName} selects the template;
 * when both are given the template name wins and the artifact type still drives naming and headers.
 */
public record ScaffoldRequest(
    String artifactType,
    String templateName,
    String name,
    Map<String, Object> values,
    Path outputPath,
    boolean write
) {
    public ScaffoldRequest {
        if (artifactType == null && templateName == null) {
            throw new IllegalArgumentException("artifactType or templateName is required");
        }
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String artifactType;
        private String templateName;
        private String name;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private Path outputPath;
        private boolean write;

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

        public ScaffoldRequest build() {
            return new ScaffoldRequest(artifactType, templateName, name, values, outputPath, write);
        }
    }
}
