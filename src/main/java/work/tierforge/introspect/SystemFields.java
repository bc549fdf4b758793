package work.tierforge.introspect;

import java.util.Set;

/**
 * Variables the pipeline injects itself; never reported as required or optional.
 */
public final class SystemFields {
    public static final String TEMPLATE_ID = "template_id";
    public static final String TEMPLATE_VERSION = "template_version";
    public static final String SCAFFOLD_CREATED = "scaffold_created";
    public static final String OUTPUT_PATH = "output_path";
    public static final String FORMAT = "format";

    public static final Set<String> NAMES = Set.of(TEMPLATE_ID, TEMPLATE_VERSION, SCAFFOLD_CREATED, OUTPUT_PATH, FORMAT);

    private SystemFields() {}

    public static boolean isSystemField(String name) {
        return NAMES.contains(name);
    }
}
