package work.tierforge.template;

import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.extension.NodeVisitorFactory;
import io.pebbletemplates.pebble.extension.core.DefaultFilter;
import io.pebbletemplates.pebble.tokenParser.TokenParser;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters and tags the scaffolding templates rely on on top of Pebble's core set.
 */
final class ScaffoldExtension extends AbstractExtension {
    private final TemplateCapture capture;

    ScaffoldExtension(TemplateCapture capture) {
        this.capture = capture;
    }

    @Override
    public Map<String, Filter> getFilters() {
        var filters = new LinkedHashMap<>(FilterLibrary.filters());
        filters.put("d", new DefaultFilter());
        filters.put("indent", new IndentFilter());
        return filters;
    }

    @Override
    public List<TokenParser> getTokenParsers() {
        return List.of(new ConditionTokenParser(), new ImportTokenParser(capture));
    }

    @Override
    public List<NodeVisitorFactory> getNodeVisitors() {
        return List.of(capture);
    }
}
