package work.tierforge.metadata;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Named provenance field with the pattern its value must match from the start.
 */
public final class MetadataField {
    private final String name;
    private final String formatRegex;
    private final Pattern format;
    private final boolean required;

    public MetadataField(String name, String formatRegex, boolean required) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("metadata field name must not be empty");
        }
        if (formatRegex == null || formatRegex.isEmpty()) {
            throw new IllegalArgumentException("metadata field '" + name + "' has an empty format_regex");
        }
        try {
            this.format = Pattern.compile(formatRegex);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(
                "metadata field '" + name + "' has an invalid format_regex: " + ex.getDescription(), ex
            );
        }
        this.name = name;
        this.formatRegex = formatRegex;
        this.required = required;
    }

    public String name() {
        return name;
    }

    public String formatRegex() {
        return formatRegex;
    }

    public boolean required() {
        return required;
    }

    public boolean accepts(String value) {
        return value != null && format.matcher(value).lookingAt();
    }

    @Override
    public String toString() {
        return "MetadataField[" + name + (required ? ", required" : "") + "]";
    }
}
