package work.tierforge.cli;

import picocli.CommandLine;
import work.tierforge.api.LogLevel;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private Main() {}

    public static void main(String[] args) {
        configureLogging(args);
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new TierforgeCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    /**
     * The simple logger reads its level once, when the first logger is created, so {@code --log-level}
     * has to be applied before picocli runs any command.
     */
    static void configureLogging(String[] args) {
        String raw = null;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--log-level") && i + 1 < args.length) {
                raw = args[i + 1];
            } else if (args[i].startsWith("--log-level=")) {
                raw = args[i].substring("--log-level=".length());
            }
        }
        if (raw == null) {
            return;
        }
        try {
            System.setProperty(LOG_LEVEL_PROPERTY, LogLevel.from(raw).simpleLoggerName());
        } catch (IllegalArgumentException ex) {
            // picocli reports the bad value when it validates the option
            System.clearProperty(LOG_LEVEL_PROPERTY);
        }
    }
}
