package work.tierforge.introspect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.error.InheritanceCycleException;

/**
 * Follows {@code extends} from a template up to its root without rendering anything.
 */
public final class InheritanceResolver {
    private static final Logger log = LoggerFactory.getLogger(InheritanceResolver.class);

    private final TemplateAstProvider provider;

    public InheritanceResolver(TemplateAstProvider provider) {
        this.provider = provider;
    }

    /**
     * @throws InheritanceCycleException when a template reappears in its own ancestry
     * @throws work.tierforge.error.TemplateNotFoundException when a template in the chain is missing
     */
    public ResolvedChain resolveChain(String templateName) {
        var visited = new LinkedHashSet<String>();
        var names = new ArrayList<String>();
        var asts = new ArrayList<TemplateAst>();
        String current = templateName;
        while (current != null) {
            if (!visited.add(current)) {
                var cycle = new ArrayList<>(visited);
                cycle.add(current);
                throw new InheritanceCycleException(cycle);
            }
            var ast = provider.load(current);
            names.add(current);
            asts.add(ast);
            current = ast.findExtendsTarget().orElse(null);
        }
        Collections.reverse(names);
        Collections.reverse(asts);
        var refs = new LinkedHashSet<String>();
        asts.forEach(ast -> refs.addAll(ast.findFreeVariableNames()));
        log.debug("Resolved {} -> {}", templateName, names);
        return new ResolvedChain(names, refs, asts);
    }
}
