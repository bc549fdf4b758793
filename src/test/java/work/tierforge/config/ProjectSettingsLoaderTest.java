package work.tierforge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.tierforge.error.ConfigException;

class ProjectSettingsLoaderTest {
    private static final Path PROJECT = Path.of("src", "test", "resources", "project").toAbsolutePath().normalize();

    @Test
    void resolvesPathsAgainstSettingsDirectory() throws Exception {
        Path dir = Files.createTempDirectory("tierforge-settings");
        Files.writeString(dir.resolve(ProjectSettingsLoader.FILE_NAME), """
            [templates]
            root = "tpl"

            [metadata]
            config = "meta/comments.yaml"

            [artifacts]
            registry = "registry/artifacts.yaml"
            versions = "registry/versions.yaml"

            [output]
            root = "generated"
            """);
        var settings = ProjectSettingsLoader.load(dir.resolve(ProjectSettingsLoader.FILE_NAME));
        Path base = dir.toAbsolutePath().normalize();

        assertEquals(base, settings.baseDirectory());
        assertEquals(base.resolve("tpl"), settings.templatesRoot());
        assertEquals(base.resolve("meta/comments.yaml"), settings.metadataConfig());
        assertEquals(base.resolve("registry/artifacts.yaml"), settings.artifactRegistry());
        assertEquals(base.resolve("registry/versions.yaml"), settings.versionRegistry());
        assertEquals(base.resolve("generated"), settings.outputRoot());
    }

    @Test
    void defaultsSkipFilesThatDoNotExist() throws Exception {
        Path dir = Files.createTempDirectory("tierforge-settings").toAbsolutePath().normalize();
        var settings = ProjectSettingsLoader.defaults(dir);

        assertEquals(dir.resolve("templates"), settings.templatesRoot());
        assertTrue(settings.metadataConfigPath().isEmpty());
        assertTrue(settings.artifactRegistryPath().isEmpty());
        assertEquals(dir.resolve(".tierforge").resolve("template_versions.yaml"), settings.versionRegistry());
        assertEquals(dir, settings.outputRoot());
    }

    @Test
    void discoversSettingsInParentDirectory() throws Exception {
        var settings = ProjectSettingsLoader.discover(PROJECT.resolve("templates").resolve("concrete"));
        assertEquals(PROJECT, settings.baseDirectory());
        assertEquals(PROJECT.resolve("templates"), settings.templatesRoot());
        assertEquals(PROJECT.resolve("artifacts.yaml"), settings.artifactRegistryPath().orElseThrow());
    }

    @Test
    void reportsInvalidSettings() throws Exception {
        Path dir = Files.createTempDirectory("tierforge-settings");
        Path broken = dir.resolve(ProjectSettingsLoader.FILE_NAME);
        Files.writeString(broken, "[templates\nroot = ");
        var syntax = assertThrows(ConfigException.class, () -> ProjectSettingsLoader.load(broken));
        assertTrue(syntax.getMessage().startsWith("Settings file has invalid syntax"), syntax.getMessage());
        assertEquals("ERR_CONFIG", syntax.code());

        Files.writeString(broken, "[templates]\nroot = 42\n");
        var type = assertThrows(ConfigException.class, () -> ProjectSettingsLoader.load(broken));
        assertTrue(type.getMessage().contains("'root' must be a string"), type.getMessage());

        Files.writeString(broken, "templates = \"templates\"\n");
        var notATable = assertThrows(ConfigException.class, () -> ProjectSettingsLoader.load(broken));
        assertTrue(notATable.getMessage().contains("[templates] must be a table"), notATable.getMessage());

        var missing = assertThrows(ConfigException.class, () -> ProjectSettingsLoader.load(dir.resolve("absent.toml")));
        assertTrue(missing.getMessage().startsWith("Settings file not found"));
    }
}
