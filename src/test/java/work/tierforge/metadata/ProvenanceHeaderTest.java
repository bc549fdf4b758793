package work.tierforge.metadata;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProvenanceHeaderTest {
    private static final Instant CREATED = Instant.parse("2026-01-27T10:00:00.750Z");

    @Test
    void rendersPathAndMetadataLines() {
        var header = new ProvenanceHeader("dto", "abc12345", CREATED, null, "backend/user_dto.py");
        assertEquals(
            "# backend/user_dto.py\n# template=dto version=abc12345 created=2026-01-27T10:00:00Z updated=\n",
            header.render(CommentSyntax.HASH)
        );
        assertEquals(
            "<!-- backend/user_dto.py -->\n<!-- template=dto version=abc12345 created=2026-01-27T10:00:00Z updated= -->\n",
            header.render(CommentSyntax.HTML_COMMENT)
        );
    }

    @Test
    void compactFormCarriesOnlyIdentity() {
        var header = new ProvenanceHeader("commit", "0badf00d", CREATED, null, null);
        assertEquals("<!-- template=commit version=0badf00d -->\n", header.renderCompact());
    }

    @Test
    void everySyntaxRoundTripsThroughTheParser() {
        var parser = new ScaffoldMetadataParser(ScaffoldMetadataConfig.defaults());
        var updated = Instant.parse("2026-02-01T08:30:00Z");
        var header = new ProvenanceHeader("worker", "1234abcd", CREATED, updated, "src/worker.file");
        var extensions = Map.of(
            CommentSyntax.HASH, ".py",
            CommentSyntax.DOUBLE_SLASH, ".ts",
            CommentSyntax.HTML_COMMENT, ".md",
            CommentSyntax.TEMPLATE_COMMENT, ".j2"
        );
        extensions.forEach((syntax, ext) -> {
            var parsed = parser.parse(header.render(syntax) + "body\n", ext).orElseThrow();
            assertEquals("worker", parsed.get("template"), syntax.id());
            assertEquals("1234abcd", parsed.get("version"), syntax.id());
            assertEquals("2026-01-27T10:00:00Z", parsed.get("created"), syntax.id());
            assertEquals("2026-02-01T08:30:00Z", parsed.get("updated"), syntax.id());
        });
    }

    @Test
    void headerWithoutPathStillParses() {
        var parser = new ScaffoldMetadataParser(ScaffoldMetadataConfig.defaults());
        var header = new ProvenanceHeader("dto", "", CREATED, null, null);
        assertEquals("", parser.parse(header.render(CommentSyntax.HASH), ".py").orElseThrow().get("version"));
    }
}
