package work.tierforge.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.tierforge.error.ScaffoldException;
import work.tierforge.error.ValidationException;
import work.tierforge.metadata.ScaffoldMetadataConfig;
import work.tierforge.metadata.ScaffoldMetadataParser;
import work.tierforge.template.TemplateEngine;

class ScaffoldPipelineTest {
    private static final Path PROJECT = Path.of("src", "test", "resources", "project");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T12:00:00Z"), ZoneOffset.UTC);

    private Path outputRoot;
    private TemplateVersionRegistry versions;
    private ScaffoldPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        outputRoot = Files.createTempDirectory("tierforge-out");
        versions = new TemplateVersionRegistry(outputRoot.resolve(".tierforge").resolve("template_versions.yaml"), CLOCK);
        pipeline = pipeline(ArtifactRegistry.load(PROJECT.resolve("artifacts.yaml")), versions);
    }

    private static ScaffoldRequest.Builder dto() {
        return ScaffoldRequest.builder()
            .artifactType("dto")
            .name("user_profile")
            .value("fields", List.of(Map.of("name", "userId", "type", "int")));
    }

    @Test
    void scaffoldsFileWithProvenanceHeader() throws Exception {
        var stages = new ArrayList<ScaffoldStage>();
        var output = pipeline.scaffold(dto().write(true).build(), stages::add);

        assertEquals(
            List.of(
                ScaffoldStage.START,
                ScaffoldStage.INTROSPECTED,
                ScaffoldStage.CONTEXT_BUILT,
                ScaffoldStage.VALIDATED,
                ScaffoldStage.RENDERED,
                ScaffoldStage.WRITTEN
            ),
            stages
        );
        assertEquals("user_profile_dto.py", output.fileName());
        assertEquals(outputRoot.resolve("user_profile_dto.py"), output.outputPath());
        assertEquals("5316ed84", output.versionHash());
        assertTrue(output.written());

        String content = Files.readString(output.outputPath());
        assertEquals(output.content(), content);
        assertTrue(content.startsWith(
            "# user_profile_dto.py\n# template=dto version=5316ed84 created=2026-03-02T12:00:00Z updated=\n"
        ), content);
        assertTrue(content.contains("class UserProfile:"), content);
        assertTrue(content.contains("user_id: int"), content);
        assertFalse(content.contains("# frozen"), content);

        var parsed = new ScaffoldMetadataParser(ScaffoldMetadataConfig.defaults()).parse(content, ".py").orElseThrow();
        assertEquals("dto", parsed.get("template"));
        assertEquals("5316ed84", parsed.get("version"));
    }

    @Test
    void recordsTierChainInVersionRegistry() {
        pipeline.scaffold(dto().build());

        var entry = versions.lookupHash("5316ed84").orElseThrow();
        assertEquals("dto", entry.artifactType());
        assertEquals(
            List.of(
                new TierVersion("tier0", "base", "1.0.0"),
                new TierVersion("tier1", "code", "1.1.0"),
                new TierVersion("tier2", "python", "2.0.0"),
                new TierVersion("concrete", "dto", "1.0.0")
            ),
            entry.tiers()
        );
        assertEquals("5316ed84", versions.currentVersion("dto").orElseThrow());
    }

    @Test
    void printOnlyRunDoesNotWrite() {
        var output = pipeline.scaffold(dto().value("frozen", true).build());
        assertFalse(output.written());
        assertFalse(Files.exists(outputRoot.resolve("user_profile_dto.py")));
        assertTrue(output.content().contains("# frozen"), output.content());
    }

    @Test
    void reportsEveryMissingField() {
        var stages = new ArrayList<ScaffoldStage>();
        var request = ScaffoldRequest.builder().artifactType("dto").write(true).build();
        var error = assertThrows(ValidationException.class, () -> pipeline.scaffold(request, stages::add));

        assertEquals("ERR_VALIDATION", error.code());
        assertEquals(List.of("fields", "name"), error.missingFields());
        assertEquals(
            List.of(ScaffoldStage.START, ScaffoldStage.INTROSPECTED, ScaffoldStage.CONTEXT_BUILT, ScaffoldStage.FAILED),
            stages
        );
        assertFalse(Files.exists(outputRoot.resolve("unnamed_dto.py")));
    }

    @Test
    void nullValueCountsAsMissing() {
        var values = new HashMap<String, Object>();
        values.put("fields", null);
        var request = ScaffoldRequest.builder().artifactType("dto").name("x").values(values).build();
        var error = assertThrows(ValidationException.class, () -> pipeline.scaffold(request));
        assertEquals(List.of("fields"), error.missingFields());
    }

    @Test
    void ephemeralOutputGetsCompactHeaderAndIsNeverWritten() {
        var stages = new ArrayList<ScaffoldStage>();
        var request = ScaffoldRequest.builder()
            .artifactType("commit")
            .value("kind", "feat")
            .value("subject", "add tiers")
            .write(true)
            .build();
        var output = pipeline.scaffold(request, stages::add);

        assertTrue(output.content().startsWith("<!-- template=commit version=c2f4a511 -->\nfeat(core): add tiers"), output.content());
        assertFalse(output.written());
        assertNull(output.outputPath());
        assertFalse(stages.contains(ScaffoldStage.WRITTEN));
        assertTrue(versions.allHashes().isEmpty());
    }

    @Test
    void missingTemplateFallsBack() {
        var request = ScaffoldRequest.builder().artifactType("design").name("tiering").value("title", "Tiering").build();
        var output = pipeline.scaffold(request);

        assertEquals("concrete/design.md.jinja2", output.templateName());
        assertEquals("tiering.md", output.fileName());
        assertTrue(output.content().startsWith("<!-- tiering.md -->\n<!-- template=design version="), output.content());
        assertTrue(output.content().contains("# Tiering"), output.content());
        assertTrue(output.content().contains("TBD"), output.content());
        assertEquals(List.of("tier0/base.jinja2", "concrete/design.md.jinja2"), output.schema().inheritanceChain());
    }

    @Test
    void templateNameWithoutArtifactType() {
        var request = ScaffoldRequest.builder()
            .templateName("concrete/commit.txt.jinja2")
            .name("message")
            .value("kind", "fix")
            .value("subject", "typo")
            .outputPath(Path.of("notes", "commit.txt"))
            .build();
        var output = pipeline.scaffold(request);

        assertEquals("commit", output.artifactType());
        assertEquals("commit.txt", output.fileName());
        assertEquals(outputRoot.resolve("notes").resolve("commit.txt"), output.outputPath());
        assertTrue(output.content().startsWith("# notes/commit.txt\n# template=commit version=c2f4a511"), output.content());
    }

    @Test
    void validateReturnsSchemaWithoutRendering() {
        var schema = pipeline.validate(dto().build());
        assertEquals(Set.of("fields", "name"), schema.required());
        assertEquals(Set.of("description", "frozen", "imports"), schema.optional());
        assertThrows(ValidationException.class, () -> pipeline.validate(ScaffoldRequest.builder().artifactType("dto").build()));
    }

    @Test
    void artifactTypesSharingATemplateGetDistinctVersions() {
        var registry = ArtifactRegistry.fromYaml(
            "artifact_types:\n"
                + "  - {type_id: dto, type: code, template_path: concrete/dto.py.jinja2, file_extension: .py, name_suffix: _dto}\n"
                + "  - {type_id: schema, type: code, template_path: concrete/dto.py.jinja2, file_extension: .py, name_suffix: _schema}\n",
            null
        );
        var shared = pipeline(registry, versions);

        var dto = shared.scaffold(dto().write(true).build());
        var schema = shared.scaffold(dto().artifactType("schema").write(true).build());

        assertNotEquals(dto.versionHash(), schema.versionHash());
        assertTrue(Files.isRegularFile(outputRoot.resolve("user_profile_dto.py")));
        assertTrue(Files.isRegularFile(outputRoot.resolve("user_profile_schema.py")));
        assertEquals("schema", versions.lookupHash(schema.versionHash()).orElseThrow().artifactType());
        assertEquals(2, versions.allHashes().size());
    }

    @Test
    void versionCollisionIsReportedBeforeAnythingIsWritten() {
        versions.saveVersion("schema", "5316ed84", List.of(new TierVersion("concrete", "schema", "1.0.0")));
        var stages = new ArrayList<ScaffoldStage>();

        var error = assertThrows(ScaffoldException.class, () -> pipeline.scaffold(dto().write(true).build(), stages::add));

        assertEquals("ERR_VERSION_COLLISION", error.code());
        assertFalse(Files.exists(outputRoot.resolve("user_profile_dto.py")));
        assertFalse(stages.contains(ScaffoldStage.WRITTEN));
        assertEquals(ScaffoldStage.FAILED, stages.get(stages.size() - 1));
    }

    @Test
    void failedVersionRecordLeavesNoFileBehind() throws Exception {
        Path unwritable = Files.createDirectories(outputRoot.resolve("registry-is-a-directory"));
        var broken = pipeline(ArtifactRegistry.load(PROJECT.resolve("artifacts.yaml")), new TemplateVersionRegistry(unwritable, CLOCK));

        var error = assertThrows(ScaffoldException.class, () -> broken.scaffold(dto().write(true).build()));

        assertEquals("ERR_IO", error.code());
        assertFalse(Files.exists(outputRoot.resolve("user_profile_dto.py")));
        try (Stream<Path> files = Files.list(outputRoot)) {
            assertEquals(List.of(unwritable), files.collect(Collectors.toList()));
        }
    }

    @Test
    void templateIdIgnoresTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("title", ScaffoldPipeline.templateId("concrete/TITLE.md.jinja2"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    private ScaffoldPipeline pipeline(ArtifactRegistry registry, TemplateVersionRegistry versionRegistry) {
        return ScaffoldPipeline.builder(new TemplateEngine(PROJECT.resolve("templates")))
            .metadataConfig(ScaffoldMetadataConfig.defaults())
            .artifacts(registry)
            .versions(versionRegistry)
            .outputRoot(outputRoot)
            .clock(CLOCK)
            .build();
    }

    @Test
    void derivesIdAndExtensionFromTemplateName() {
        assertEquals("dto", ScaffoldPipeline.templateId("concrete/dto.py.jinja2"));
        assertEquals("readme", ScaffoldPipeline.templateId("concrete/readme.md.j2"));
        assertEquals(".py", ScaffoldPipeline.outputExtension("concrete/dto.py.jinja2"));
        assertEquals(".txt", ScaffoldPipeline.outputExtension("concrete/notes.jinja2"));
    }
}
