package work.tierforge.introspect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inputs a template needs: {@code required} must be supplied, {@code optional} may be. The sets are
 * sorted and disjoint.
 */
public record TemplateSchema(Set<String> required, Set<String> optional, List<String> inheritanceChain) {
    public TemplateSchema {
        required = Collections.unmodifiableSortedSet(new TreeSet<>(required));
        optional = Collections.unmodifiableSortedSet(new TreeSet<>(optional));
        inheritanceChain = List.copyOf(inheritanceChain);
        for (String name : required) {
            if (optional.contains(name)) {
                throw new IllegalArgumentException("'" + name + "' cannot be both required and optional");
            }
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("required", new ArrayList<>(required));
        map.put("optional", new ArrayList<>(optional));
        map.put("inheritance_chain", inheritanceChain);
        return map;
    }
}
