package work.tierforge.introspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Documentation block a template declares about itself in a {@code TEMPLATE_METADATA} comment.
 * Any field may be {@code null} when the block omits it; unrecognised keys stay in {@code attributes}.
 */
public record TemplateHeader(
    String id,
    String version,
    String tier,
    String parent,
    List<String> exports,
    String description,
    Map<String, Object> attributes
) {
    public TemplateHeader {
        exports = exports == null ? List.of() : List.copyOf(exports);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
