package work.tierforge.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.tierforge.error.MetadataParseException;

/**
 * Reads the provenance header at the top of a generated file.
 *
 * <p>Content that simply is not a scaffolded file yields an empty result; a header that is present but
 * malformed raises {@link MetadataParseException}.
 */
public final class ScaffoldMetadataParser {
    private static final Pattern KEY_VALUE = Pattern.compile("(\\w+)=(\\S*)");

    private final ScaffoldMetadataConfig config;

    public ScaffoldMetadataParser(ScaffoldMetadataConfig config) {
        this.config = config;
    }

    /**
     * @param content   file content
     * @param extension file extension, with or without the leading dot
     * @return validated known fields, or empty when the content carries no header for that extension
     */
    public Optional<Map<String, String>> parse(String content, String extension) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        String[] lines = content.split("\n", 3);
        String first = lines[0].strip();
        if (first.isEmpty()) {
            return Optional.empty();
        }
        var pattern = config.patternForExtension(extension);
        if (pattern.isEmpty()) {
            return Optional.empty();
        }
        var metadata = pattern.get().extractMetadata(first);
        if (metadata.isEmpty() && lines.length > 1 && pattern.get().isFilepathLine(first)) {
            metadata = pattern.get().extractMetadata(lines[1].strip());
        }
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(validate(tokenize(metadata.get())));
    }

    private static Map<String, String> tokenize(String metadata) {
        var pairs = new LinkedHashMap<String, String>();
        var matcher = KEY_VALUE.matcher(metadata);
        while (matcher.find()) {
            pairs.put(matcher.group(1), matcher.group(2));
        }
        if (pairs.isEmpty()) {
            throw new MetadataParseException("no valid key=value pairs in '" + metadata + "'");
        }
        return pairs;
    }

    private Map<String, String> validate(Map<String, String> pairs) {
        for (var field : config.fields()) {
            if (field.required() && !pairs.containsKey(field.name())) {
                throw new MetadataParseException("missing required field: " + field.name(), field.name());
            }
        }
        var validated = new LinkedHashMap<String, String>();
        pairs.forEach((key, value) -> {
            var field = config.getField(key);
            if (field.isEmpty()) {
                return;
            }
            if (!field.get().accepts(value)) {
                throw new MetadataParseException(
                    "invalid value '" + value + "' for field '" + key + "' (expected " + field.get().formatRegex() + ")",
                    key
                );
            }
            validated.put(key, value);
        });
        return Collections.unmodifiableMap(validated);
    }
}
