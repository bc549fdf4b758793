package work.tierforge.api;

import java.util.Locale;

/**
 * Log levels accepted by {@code --log-level}, mapped onto the SLF4J simple logger.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String simpleLoggerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
