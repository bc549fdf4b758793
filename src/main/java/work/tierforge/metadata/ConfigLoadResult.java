package work.tierforge.metadata;

import java.util.Optional;
import work.tierforge.error.ConfigException;

/**
 * Outcome of {@link ScaffoldMetadataConfig#tryLoad}: exactly one of config and error is present.
 */
public record ConfigLoadResult(ScaffoldMetadataConfig config, ConfigException error) {
    public ConfigLoadResult {
        if ((config == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of config and error must be set");
        }
    }

    public static ConfigLoadResult success(ScaffoldMetadataConfig config) {
        return new ConfigLoadResult(config, null);
    }

    public static ConfigLoadResult failure(ConfigException error) {
        return new ConfigLoadResult(null, error);
    }

    public boolean ok() {
        return config != null;
    }

    public Optional<ScaffoldMetadataConfig> configIfPresent() {
        return Optional.ofNullable(config);
    }
}
