package work.tierforge.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * How a provenance header is recognised in one comment syntax. The metadata line pattern either captures
 * the {@code key=value} run in group 1 or, without groups, matches the whole line, in which case the
 * prefix and closing delimiter are stripped off.
 */
public final class CommentPattern {
    private static final Pattern CLOSING_DELIMITER = Pattern.compile("\\s*(-->|#\\})$");

    private final CommentSyntax syntax;
    private final String prefix;
    private final Pattern prefixPattern;
    private final Pattern metadataLinePattern;
    private final Pattern filepathLinePattern;
    private final List<String> extensions;

    public CommentPattern(
        CommentSyntax syntax,
        String prefix,
        String metadataLineRegex,
        String filepathLineRegex,
        List<String> extensions
    ) {
        if (syntax == null) {
            throw new IllegalArgumentException("comment pattern syntax is required");
        }
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("comment pattern '" + syntax.id() + "' has an empty prefix");
        }
        if (metadataLineRegex == null || metadataLineRegex.isEmpty()) {
            throw new IllegalArgumentException("comment pattern '" + syntax.id() + "' has an empty metadata_line_regex");
        }
        this.syntax = syntax;
        this.prefix = prefix;
        this.prefixPattern = compile(syntax, "prefix", prefix);
        this.metadataLinePattern = compile(syntax, "metadata_line_regex", metadataLineRegex);
        this.filepathLinePattern = filepathLineRegex == null || filepathLineRegex.isEmpty()
            ? null
            : compile(syntax, "filepath_line_regex", filepathLineRegex);
        var normalized = new ArrayList<String>();
        if (extensions != null) {
            extensions.forEach(ext -> normalized.add(CommentSyntax.normalizeExtension(ext)));
        }
        this.extensions = List.copyOf(normalized);
    }

    public CommentPattern(CommentSyntax syntax, String prefix, String metadataLineRegex) {
        this(syntax, prefix, metadataLineRegex, null, List.of());
    }

    public CommentSyntax syntax() {
        return syntax;
    }

    public String prefix() {
        return prefix;
    }

    public Pattern metadataLinePattern() {
        return metadataLinePattern;
    }

    public Optional<Pattern> filepathLinePattern() {
        return Optional.ofNullable(filepathLinePattern);
    }

    /**
     * Extensions listed explicitly for this pattern; empty means the syntax's default extensions apply.
     */
    public List<String> extensions() {
        return extensions;
    }

    /**
     * Returns the {@code key=value} run of a metadata line, or empty when the line is not one.
     */
    public Optional<String> extractMetadata(String line) {
        var matcher = metadataLinePattern.matcher(line);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        if (matcher.groupCount() >= 1 && matcher.group(1) != null) {
            return Optional.of(matcher.group(1).strip());
        }
        String stripped = prefixPattern.matcher(line).replaceFirst("");
        return Optional.of(CLOSING_DELIMITER.matcher(stripped.strip()).replaceFirst("").strip());
    }

    public boolean isFilepathLine(String line) {
        return filepathLinePattern != null && filepathLinePattern.matcher(line).lookingAt();
    }

    private static Pattern compile(CommentSyntax syntax, String field, String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(
                "comment pattern '" + syntax.id() + "' has an invalid " + field + ": " + ex.getDescription(), ex
            );
        }
    }

    @Override
    public String toString() {
        return "CommentPattern[" + syntax.id() + "]";
    }
}
