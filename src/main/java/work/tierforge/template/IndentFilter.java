package work.tierforge.template;

import io.pebbletemplates.pebble.error.PebbleException;
import io.pebbletemplates.pebble.extension.Filter;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.util.List;
import java.util.Map;

/**
 * {@code text | indent(width=4, first=false)}: indents every line but the first by {@code width} spaces.
 * Blank lines stay empty.
 */
final class IndentFilter implements Filter {
    private static final List<String> ARGUMENTS = List.of("width", "first");
    private static final int MAX_WIDTH = 1024;

    @Override
    public List<String> getArgumentNames() {
        return ARGUMENTS;
    }

    @Override
    public Object apply(Object input, Map<String, Object> args, PebbleTemplate self, EvaluationContext context, int lineNumber) {
        if (input == null) {
            return null;
        }
        Object width = args.getOrDefault("width", 4);
        if (!(width instanceof Number number) || number.longValue() < 0 || number.longValue() > MAX_WIDTH) {
            throw new PebbleException(null, "indent width must be between 0 and " + MAX_WIDTH + ", got " + width, lineNumber, self.getName());
        }
        String pad = " ".repeat(number.intValue());
        boolean first = Boolean.TRUE.equals(args.get("first"));
        String[] lines = String.valueOf(input).split("\n", -1);
        var sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if ((i > 0 || first) && !lines[i].isBlank()) {
                sb.append(pad);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }
}
