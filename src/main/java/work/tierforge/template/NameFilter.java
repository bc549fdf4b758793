package work.tierforge.template;

import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Adapts a string-to-string function to a template filter. Strings, numbers and booleans are accepted
 * as input; anything else, or a function that rejects its input, fails the render at the filter's line.
 */
final class NameFilter implements Filter {
    private final String name;
    private final UnaryOperator<String> function;

    NameFilter(String name, UnaryOperator<String> function) {
        this.name = name;
        this.function = function;
    }

    @Override
    public List<String> getArgumentNames() {
        return List.of();
    }

    @Override
    public Object apply(Object input, Map<String, Object> args, PebbleTemplate self, EvaluationContext context, int lineNumber) {
        if (!(input instanceof CharSequence || input instanceof Number || input instanceof Boolean)) {
            String type = input == null ? "null" : input.getClass().getSimpleName();
            throw new PebbleException(null, name + " expects a string, got " + type, lineNumber, self.getName());
        }
        try {
            return function.apply(String.valueOf(input));
        } catch (IllegalArgumentException ex) {
            throw new PebbleException(ex, name + ": " + ex.getMessage(), lineNumber, self.getName());
        }
    }
}
