package work.tierforge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScaffoldRunnerTest {
    private static final Path PROJECT = Path.of("src", "test", "resources", "project").toAbsolutePath().normalize();

    private Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        workspace = Files.createTempDirectory("tierforge-runner");
        Files.writeString(workspace.resolve("tierforge.toml"), String.format(
            "[templates]%nroot = \"%s\"%n%n[artifacts]%nregistry = \"%s\"%n",
            portable(PROJECT.resolve("templates")),
            portable(PROJECT.resolve("artifacts.yaml"))
        ));
    }

    private static String portable(Path path) {
        return path.toString().replace('\\', '/');
    }

    private ScaffoldRunConfiguration.Builder dto() {
        return ScaffoldRunConfiguration.builder()
            .workingDirectory(workspace)
            .artifactType("dto")
            .name("order")
            .value("fields", List.of(Map.of("name", "orderId", "type", "str")));
    }

    @Test
    void successCarriesOutputMetadata() {
        var result = new ScaffoldRunner().run(dto().write(true).build());

        assertTrue(result.ok(), () -> String.valueOf(result.metadata()));
        assertEquals(0, result.status().exitCode());
        assertEquals("dto", result.metadata().get("target"));
        assertEquals("WRITTEN", result.metadata().get("stage"));
        assertEquals("order_dto.py", result.metadata().get("file_name"));
        assertEquals(Boolean.TRUE, result.metadata().get("written"));
        assertTrue(Files.isRegularFile(workspace.resolve("order_dto.py")));
        assertTrue(Files.isRegularFile(workspace.resolve(".tierforge").resolve("template_versions.yaml")));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
    }

    @Test
    void validateOnlyReportsSchema() {
        var result = new ScaffoldRunner().run(dto().validateOnly(true).build());

        assertTrue(result.ok());
        assertEquals("VALIDATED", result.metadata().get("stage"));
        @SuppressWarnings("unchecked")
        var schema = (Map<String, Object>) result.metadata().get("schema");
        assertEquals(List.of("fields", "name"), schema.get("required"));
        assertFalse(Files.exists(workspace.resolve("order_dto.py")));
    }

    @Test
    void validationFailureIsReportedNotThrown() {
        var configuration = ScaffoldRunConfiguration.builder()
            .workingDirectory(workspace)
            .artifactType("dto")
            .write(true)
            .build();
        var result = new ScaffoldRunner().run(configuration);

        assertFalse(result.ok());
        assertEquals(1, result.status().exitCode());
        assertEquals("FAILED", result.metadata().get("stage"));
        assertEquals("CONTEXT_BUILT", result.metadata().get("failedAfter"));
        assertEquals("ERR_VALIDATION", result.metadata().get("code"));
        assertEquals(List.of("fields", "name"), result.metadata().get("missing"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("fields, name"));
    }

    @Test
    void unknownArtifactTypeFailsBeforeIntrospection() {
        var configuration = ScaffoldRunConfiguration.builder()
            .workingDirectory(workspace)
            .artifactType("adr")
            .build();
        var result = new ScaffoldRunner().run(configuration);

        assertFalse(result.ok());
        assertEquals("START", result.metadata().get("failedAfter"));
        assertEquals("ERR_CONFIG", result.metadata().get("code"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("Available: dto, design, commit"));
    }

    @Test
    void unexpectedFailureIsReportedNotThrown() {
        var unprintable = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("value cannot be shown");
            }
        };
        var configuration = ScaffoldRunConfiguration.builder()
            .workingDirectory(workspace)
            .artifactType("dto")
            .value("name", unprintable)
            .value("fields", List.of())
            .build();
        var result = new ScaffoldRunner().run(configuration);

        assertFalse(result.ok());
        assertEquals("FAILED", result.metadata().get("stage"));
        assertEquals("ERR_INTERNAL", result.metadata().get("code"));
        assertEquals("value cannot be shown", result.metadata().get("error"));
    }

    @Test
    void outOfRangeIndexIsARenderFailure() throws Exception {
        Path templates = Files.createDirectories(workspace.resolve("inline"));
        Files.writeString(templates.resolve("list.j2"), "{{ items[99999999999] }}");
        var configuration = ScaffoldRunConfiguration.builder()
            .workingDirectory(workspace)
            .templatesRoot(templates)
            .templateName("list.j2")
            .value("items", List.of("a"))
            .build();
        var result = new ScaffoldRunner().run(configuration);

        assertFalse(result.ok());
        assertEquals("VALIDATED", result.metadata().get("failedAfter"));
        assertEquals("ERR_RENDER", result.metadata().get("code"));
        assertTrue(String.valueOf(result.metadata().get("error")).contains("99999999999"), () -> String.valueOf(result.metadata()));
    }

    @Test
    void logLevelDefaultsToWarn() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" Debug "));
        assertEquals("off", LogLevel.OFF.simpleLoggerName());
    }
}
