package work.tierforge.introspect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.tierforge.error.TemplateSyntaxException;

/**
 * Extracts the {@code {# TEMPLATE_METADATA: ... #}} block from template source.
 */
public final class TemplateHeaderReader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern BLOCK = Pattern.compile("\\{#-?\\s*TEMPLATE_METADATA:(.*?)-?#\\}", Pattern.DOTALL);
    private static final List<String> KNOWN_KEYS = List.of("id", "version", "tier", "extends", "exports", "description");

    private TemplateHeaderReader() {}

    /**
     * Returns the header of the template, or empty when the source carries none.
     *
     * @throws TemplateSyntaxException when the block is not a YAML mapping
     */
    public static Optional<TemplateHeader> read(String templateName, String source) {
        if (source == null) {
            return Optional.empty();
        }
        var matcher = BLOCK.matcher(source);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Map<String, Object> values;
        try {
            values = YAML_MAPPER.readValue(stripIndent(matcher.group(1)), new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException ex) {
            int line = (int) source.substring(0, matcher.start()).chars().filter(c -> c == '\n').count() + 1;
            throw new TemplateSyntaxException(templateName, line, "invalid TEMPLATE_METADATA block: " + ex.getOriginalMessage());
        }
        if (values == null) {
            return Optional.empty();
        }
        var attributes = new LinkedHashMap<>(values);
        KNOWN_KEYS.forEach(attributes::remove);
        return Optional.of(new TemplateHeader(
            text(values.get("id")),
            text(values.get("version")),
            text(values.get("tier")),
            text(values.get("extends")),
            exports(values.get("exports")),
            text(values.get("description")),
            attributes
        ));
    }

    private static String stripIndent(String block) {
        // YAML wants the first line flush with the rest of the block
        String trimmed = block.startsWith("\n") || block.startsWith("\r\n") ? block : "\n" + block.stripLeading();
        return trimmed.stripIndent();
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> exports(Object value) {
        var result = new ArrayList<String>();
        if (value instanceof List<?> list) {
            list.forEach(item -> result.add(String.valueOf(item)));
        } else if (value instanceof Map<?, ?> map) {
            // grouped form, e.g. {blocks: [...], macros: [...]}
            map.values().forEach(group -> result.addAll(exports(group)));
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }
}
