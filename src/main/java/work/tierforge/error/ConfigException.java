package work.tierforge.error;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration source missing, unparsable or structurally invalid.
 */
public final class ConfigException extends ScaffoldException {
    private final Path filePath;

    public ConfigException(String message) {
        this(message, null, List.of(), null);
    }

    public ConfigException(String message, Path filePath) {
        this(message, filePath, List.of(), null);
    }

    public ConfigException(String message, Path filePath, List<String> hints) {
        this(message, filePath, hints, null);
    }

    public ConfigException(String message, Path filePath, List<String> hints, Throwable cause) {
        super("ERR_CONFIG", filePath == null ? message : message + " (" + filePath + ")", hints, cause);
        this.filePath = filePath;
    }

    public Path filePath() {
        return filePath;
    }
}
