package work.tierforge.template;

import io.pebbletemplates.pebble.extension.AbstractNodeVisitor;
import io.pebbletemplates.pebble.extension.NodeVisitor;
import io.pebbletemplates.pebble.extension.NodeVisitorFactory;
import io.pebbletemplates.pebble.node.RootNode;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import io.pebbletemplates.pebble.template.PebbleTemplateImpl;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the syntax tree of every template the engine compiles, keyed by normalized template name, so
 * that templates can be inspected without being rendered.
 */
final class TemplateCapture implements NodeVisitorFactory {
    private final Map<String, ParsedTemplate> parsed = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> pendingAliases = new ConcurrentHashMap<>();

    @Override
    public NodeVisitor createVisitor(PebbleTemplate template) {
        return new AbstractNodeVisitor((PebbleTemplateImpl) template) {
            @Override
            public void visit(RootNode node) {
                String name = TemplateRootLoader.normalize(getTemplate().getName());
                Set<String> aliases = pendingAliases.remove(name);
                parsed.put(name, new ParsedTemplate(name, node, aliases == null ? Set.of() : aliases));
            }
        };
    }

    void recordImportAlias(String templateName, String alias) {
        pendingAliases.computeIfAbsent(TemplateRootLoader.normalize(templateName), key -> new LinkedHashSet<>()).add(alias);
    }

    ParsedTemplate get(String templateName) {
        return parsed.get(templateName);
    }

    void forget(String templateName) {
        parsed.remove(templateName);
        pendingAliases.remove(templateName);
    }

    void clear() {
        parsed.clear();
        pendingAliases.clear();
    }
}
