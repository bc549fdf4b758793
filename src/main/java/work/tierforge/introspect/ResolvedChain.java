package work.tierforge.introspect;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inheritance chain of a template, root first. {@code asts} is aligned with {@code chain}.
 */
public record ResolvedChain(List<String> chain, Set<String> allVariableRefs, List<TemplateAst> asts) {
    public ResolvedChain {
        chain = List.copyOf(chain);
        allVariableRefs = Collections.unmodifiableSortedSet(new TreeSet<>(allVariableRefs));
        asts = List.copyOf(asts);
        if (chain.size() != asts.size()) {
            throw new IllegalArgumentException("chain and asts must have the same length");
        }
    }

    /**
     * The queried template (last element of the chain).
     */
    public String leaf() {
        return chain.get(chain.size() - 1);
    }
}
