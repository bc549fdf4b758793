package work.tierforge.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.tierforge.error.MetadataParseException;

class ScaffoldMetadataParserTest {
    private final ScaffoldMetadataParser parser = new ScaffoldMetadataParser(ScaffoldMetadataConfig.defaults());

    @Test
    void parsesSingleLineHeader() {
        var parsed = parser.parse("# SCAFFOLD: template=dto version=abc12345 created=2026-01-20T14:00:00Z\nbody", ".py");
        assertEquals(Map.of("template", "dto", "version", "abc12345", "created", "2026-01-20T14:00:00Z"), parsed.orElseThrow());
    }

    @Test
    void parsesTwoLineHeaderAfterFilePath() {
        String content = "// src/user.ts\n// template=worker version=0badf00d created=2026-01-27T10:00Z updated=\nexport {};\n";
        var parsed = parser.parse(content, "ts").orElseThrow();
        assertEquals("worker", parsed.get("template"));
        assertEquals("", parsed.get("updated"));
    }

    @Test
    void parsesHtmlAndTemplateComments() {
        var html = parser.parse("<!-- docs/design.md -->\n<!-- template=design version= created=2026-01-27T10:00:00Z -->\n# Title", ".md");
        assertEquals("design", html.orElseThrow().get("template"));
        var jinja = parser.parse("{# template=base version=12345678 created=2026-01-27T10:00:00Z #}", ".j2");
        assertEquals("12345678", jinja.orElseThrow().get("version"));
    }

    @Test
    void missingRequiredFieldIsNamed() {
        var error = assertThrows(MetadataParseException.class,
            () -> parser.parse("# SCAFFOLD: template=dto created=2026-01-20T14:00:00Z", ".py"));
        assertTrue(error.getMessage().contains("version"));
        assertEquals("version", error.field());
    }

    @Test
    void invalidValueIsNamed() {
        var error = assertThrows(MetadataParseException.class,
            () -> parser.parse("# template=Bad_Name version=abc12345 created=2026-01-20T14:00:00Z", ".py"));
        assertTrue(error.getMessage().contains("invalid value 'Bad_Name' for field 'template'"), error.getMessage());
    }

    @Test
    void unknownFieldsAreDropped() {
        var parsed = parser.parse(
            "# template=dto version=abc12345 created=2026-01-20T14:00:00Z extra_field=ignored", ".py").orElseThrow();
        assertFalse(parsed.containsKey("extra_field"));
        assertEquals(3, parsed.size());
    }

    @Test
    void lastDuplicateWins() {
        var lenient = new ScaffoldMetadataParser(
            ScaffoldMetadataConfig.load(Path.of("src", "test", "resources", "metadata", "lenient_versions.yaml")));
        var parsed = lenient.parse("# template=dto template=worker version=1.0 created=2026-01-20T14:00:00Z", ".py");
        assertEquals("worker", parsed.orElseThrow().get("template"));
        assertEquals("1.0", parsed.orElseThrow().get("version"));
    }

    @Test
    void ordinaryContentIsNotScaffolded() {
        assertTrue(parser.parse("import os\nprint('hi')\n", ".py").isEmpty());
        assertTrue(parser.parse("# just a comment\n", ".py").isEmpty());
        assertTrue(parser.parse("", ".py").isEmpty());
        assertTrue(parser.parse("\n# template=dto version= created=2026-01-20T14:00Z", ".py").isEmpty());
        assertTrue(parser.parse("# template=dto version= created=2026-01-20T14:00Z", ".unknown").isEmpty());
    }

    @Test
    void fieldNamesAreCaseSensitive() {
        assertThrows(MetadataParseException.class,
            () -> parser.parse("# Template=dto version=abc12345 created=2026-01-20T14:00:00Z", ".py"));
    }
}
