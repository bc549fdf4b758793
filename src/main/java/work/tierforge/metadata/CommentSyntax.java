package work.tierforge.metadata;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Comment families a provenance header can be written in, with the extensions that use each one by
 * default.
 */
public enum CommentSyntax {
    HASH("hash", "# ", "", List.of(".py", ".yaml", ".yml", ".sh", ".txt", ".toml")),
    DOUBLE_SLASH("double_slash", "// ", "", List.of(".ts", ".js", ".java", ".cs", ".kt", ".go")),
    HTML_COMMENT("html_comment", "<!-- ", " -->", List.of(".md", ".html", ".xml")),
    TEMPLATE_COMMENT("template_comment", "{# ", " #}", List.of(".jinja2", ".j2"));

    private final String id;
    private final String linePrefix;
    private final String lineSuffix;
    private final List<String> defaultExtensions;

    CommentSyntax(String id, String linePrefix, String lineSuffix, List<String> defaultExtensions) {
        this.id = id;
        this.linePrefix = linePrefix;
        this.lineSuffix = lineSuffix;
        this.defaultExtensions = defaultExtensions;
    }

    public String id() {
        return id;
    }

    public List<String> defaultExtensions() {
        return defaultExtensions;
    }

    /**
     * Wraps {@code content} in this syntax's comment delimiters.
     */
    public String commentLine(String content) {
        return linePrefix + content + lineSuffix;
    }

    public static Optional<CommentSyntax> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        if (id.equals("jinja_comment")) {
            return Optional.of(TEMPLATE_COMMENT);
        }
        for (var syntax : values()) {
            if (syntax.id.equals(id)) {
                return Optional.of(syntax);
            }
        }
        return Optional.empty();
    }

    public static Optional<CommentSyntax> forExtension(String extension) {
        String normalized = normalizeExtension(extension);
        for (var syntax : values()) {
            if (syntax.defaultExtensions.contains(normalized)) {
                return Optional.of(syntax);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code "PY"}, {@code "py"} and {@code ".py"} all become {@code ".py"}.
     */
    public static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        String lower = extension.strip().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
