package work.tierforge.template;

import io.pebbletemplates.pebble.extension.Filter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Name-casing and identifier filters used by the scaffolding templates.
 */
public final class FilterLibrary {
    private static final Pattern CAMEL_WORD = Pattern.compile("(.)([A-Z][a-z]+)");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

    private FilterLibrary() {}

    /**
     * The filters under the names templates use for them.
     */
    public static Map<String, Filter> filters() {
        var filters = new LinkedHashMap<String, Filter>();
        filters.put("pascalcase", new NameFilter("pascalcase", FilterLibrary::pascalCase));
        filters.put("snakecase", new NameFilter("snakecase", FilterLibrary::snakeCase));
        filters.put("kebabcase", new NameFilter("kebabcase", FilterLibrary::kebabCase));
        filters.put("validate_identifier", new NameFilter("validate_identifier", FilterLibrary::validateIdentifier));
        return filters;
    }

    /**
     * {@code "test_name"} and {@code "test-name"} become {@code "TestName"}; already Pascal-cased input is
     * returned unchanged.
     */
    public static String pascalCase(String value) {
        var sb = new StringBuilder();
        for (String part : snakeCase(value).split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    public static String snakeCase(String value) {
        String s = CAMEL_WORD.matcher(value).replaceAll("$1_$2");
        s = CAMEL_BOUNDARY.matcher(s).replaceAll("$1_$2");
        return s.replace('-', '_').toLowerCase(Locale.ROOT);
    }

    public static String kebabCase(String value) {
        return snakeCase(value).replace('_', '-');
    }

    /**
     * Returns the value when it is a valid identifier (a letter or underscore followed by letters, digits or
     * underscores).
     *
     * @throws IllegalArgumentException otherwise
     */
    public static String validateIdentifier(String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid identifier: '" + value + "'");
        }
        return value;
    }
}
