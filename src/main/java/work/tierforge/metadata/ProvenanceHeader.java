package work.tierforge.metadata;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Provenance comment stamped at the top of generated output: a file path line followed by a
 * {@code template= version= created= updated=} line, or a single compact line for output that is never
 * written to disk.
 */
public record ProvenanceHeader(String templateId, String version, Instant created, Instant updated, String filePath) {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
        .withZone(ZoneOffset.UTC);

    public ProvenanceHeader {
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(created, "created");
        created = created.truncatedTo(ChronoUnit.SECONDS);
        updated = updated == null ? null : updated.truncatedTo(ChronoUnit.SECONDS);
        filePath = filePath == null ? null : filePath.replace('\\', '/');
    }

    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    public String metadataLine() {
        return "template=" + templateId
            + " version=" + version
            + " created=" + timestamp(created)
            + " updated=" + (updated == null ? "" : timestamp(updated));
    }

    /**
     * Both header lines, each terminated by a newline. Without a file path only the metadata line is
     * written.
     */
    public String render(CommentSyntax syntax) {
        var sb = new StringBuilder();
        if (filePath != null && !filePath.isEmpty()) {
            sb.append(syntax.commentLine(filePath)).append('\n');
        }
        sb.append(syntax.commentLine(metadataLine())).append('\n');
        return sb.toString();
    }

    public String renderCompact() {
        return CommentSyntax.HTML_COMMENT.commentLine("template=" + templateId + " version=" + version) + "\n";
    }
}
