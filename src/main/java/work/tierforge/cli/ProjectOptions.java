package work.tierforge.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.tierforge.api.LogLevel;
import work.tierforge.api.ScaffoldWorkspace;
import work.tierforge.config.ProjectSettings;
import work.tierforge.config.ProjectSettingsLoader;

/**
 * Options every subcommand shares for locating the project.
 */
final class ProjectOptions {
    @CommandLine.Option(
        names = {"-C", "--project-dir"},
        description = "Project directory; tierforge.toml is looked up from here.",
        defaultValue = "."
    )
    Path projectDirectory = Path.of(".");

    @CommandLine.Option(
        names = "--settings",
        description = "Explicit tierforge.toml to use instead of discovery.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path settingsFile;

    @CommandLine.Option(
        names = "--templates",
        description = "Template root (overrides [templates] root).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path templatesRoot;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    LogLevel logLevel() {
        return LogLevel.from(logLevelRaw);
    }

    ProjectSettings settings() {
        var settings = settingsFile != null
            ? ProjectSettingsLoader.load(settingsFile)
            : ProjectSettingsLoader.discover(projectDirectory);
        if (templatesRoot != null) {
            settings = settings.withTemplatesRoot(templatesRoot.toAbsolutePath().normalize());
        }
        return settings;
    }

    ScaffoldWorkspace openWorkspace() {
        return ScaffoldWorkspace.open(settings());
    }
}
